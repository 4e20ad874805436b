package com.tariffwise.core.gate;

import com.tariffwise.core.model.AttemptStatus;
import com.tariffwise.core.model.GateResult;
import com.tariffwise.core.persistence.AttemptRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Counts automated attempts per conversation thread and stops automated output once a
 * thread has used up {@code maxAttempts}.
 * <p>
 * Requests with neither a subject nor a reference id carry no thread identity and are always
 * allowed. Store failures propagate to the pipeline, which fails open.
 */
@Component
public class LoopBreakerGate implements ValidationGate {

    private static final Logger log = LoggerFactory.getLogger(LoopBreakerGate.class);

    public static final String NAME = "loop_breaker";

    private final AttemptRecordStore store;
    private final ThreadKeys threadKeys;
    private final int maxAttempts;

    public LoopBreakerGate(AttemptRecordStore store, GateProperties props) {
        this.store = store;
        this.threadKeys = new ThreadKeys(props.getLoopBreaker().getTrackingTokenPattern());
        this.maxAttempts = props.getLoopBreaker().getMaxAttempts();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public GateResult apply(GateContext context) {
        String key = threadKeys.keyFor(context.request());
        if (key == null) {
            context.setAttemptStatus(AttemptStatus.allowed(null, 1, List.of()));
            return GateResult.passed(NAME, List.of("No thread identity; attempt not tracked"));
        }

        AttemptStatus status = store.incrementOrCreate(key, maxAttempts, context.request().subject());
        context.setAttemptStatus(status);

        if (status.escalate()) {
            String finding = "Thread " + key + " reached " + maxAttempts + " automated attempt(s); escalation required";
            context.audit(NAME, key, "escalated", finding + ". Prior codes: " + status.priorCodes());
            log.warn("Escalating thread {} at attempt {}", key, status.attemptNumber());
            return GateResult.blocked(NAME, List.of(finding));
        }
        context.audit(NAME, key, "allowed", "Attempt " + status.attemptNumber() + " of " + maxAttempts);
        return GateResult.passed(NAME, List.of("Attempt " + status.attemptNumber() + " of " + maxAttempts));
    }

    ThreadKeys threadKeys() {
        return threadKeys;
    }
}
