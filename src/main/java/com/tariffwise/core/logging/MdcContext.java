package com.tariffwise.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tariffwise-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String ROUND = "round";
    public static final String PROVIDER = "provider";

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put(REQUEST_ID, requestId);
    }

    public static void setRound(int round, String provider) {
        MDC.put(ROUND, String.valueOf(round));
        MDC.put(PROVIDER, provider);
    }

    public static void clearRound() {
        MDC.remove(ROUND);
        MDC.remove(PROVIDER);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        clearRound();
    }
}
