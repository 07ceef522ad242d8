package com.ivamare.eventsourcing.pipeline;

import org.slf4j.MDC;

/**
 * MDC keys set by the buses for the duration of a request.
 */
public final class RequestMdc {

    public static final String CORRELATION_ID = "correlationId";
    public static final String REQUEST_TYPE = "requestType";

    private RequestMdc() {
    }

    public static void put(String correlationId, String requestType) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID, correlationId);
        }
        if (requestType != null) {
            MDC.put(REQUEST_TYPE, requestType);
        }
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID);
        MDC.remove(REQUEST_TYPE);
    }
}
