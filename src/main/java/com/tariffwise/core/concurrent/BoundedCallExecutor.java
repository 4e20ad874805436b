package com.tariffwise.core.concurrent;

import jakarta.annotation.PreDestroy;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a blocking call on a worker thread and waits for it at most a given time.
 * <p>
 * The caller still waits synchronously; the worker only exists so that a slow provider or
 * tool cannot hold the caller past its timeout. The caller's MDC is copied into the worker.
 * On timeout the worker is interrupted.
 */
@Component
public class BoundedCallExecutor {

    private final ExecutorService delegate;

    public BoundedCallExecutor() {
        this.delegate = Executors.newCachedThreadPool(new DaemonThreadFactory());
    }

    public <T> T call(Callable<T> task, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        Future<T> future = delegate.submit(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
        long millis = Math.max(1, timeout.toMillis());
        try {
            return future.get(millis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        delegate.shutdownNow();
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "tariffwise-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
