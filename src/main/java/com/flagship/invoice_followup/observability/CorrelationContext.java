package com.flagship.invoice_followup.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * HTTP requests take the id from X-Correlation-ID (see {@link CorrelationIdFilter});
 * scheduler ticks open a fresh one per tick so every line of one scan/dispatch cycle
 * can be grepped together.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String FOLLOW_UP_ID_MDC_KEY = "followUpId";
    public static final String OWNER_ID_MDC_KEY = "ownerId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Starts a new correlation scope for background work and publishes it to the MDC.
     *
     * @param prefix short label of the job, e.g. "scan" or "sweep"
     * @return the new id
     */
    public static String begin(String prefix) {
        String id = prefix + "-" + generateCorrelationId();
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Clears the thread-local id and every MDC key this class owns.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(FOLLOW_UP_ID_MDC_KEY);
        MDC.remove(OWNER_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }
}
