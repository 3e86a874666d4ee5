package com.flagship.practice_analytics.observability;

import com.flagship.practice_analytics.scope.AnalyticsScope;
import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request-scoped logging context, kept in the SLF4J MDC.
 *
 * Every log line of a request carries its correlation ID and, once the controller
 * knows it, the analytics scope being computed (for example {@code client:<uuid>}).
 * Caller-supplied IDs are only trusted when they are short and made of safe
 * characters, since they end up verbatim in log lines and response headers.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SCOPE_MDC_KEY = "scope";

    static final int MAX_CORRELATION_ID_LENGTH = 64;

    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("[A-Za-z0-9._:-]+");

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Starts the context of a request.
     *
     * @param requestedId the incoming header value, may be null
     * @return the correlation ID in effect: the requested one when acceptable, otherwise a generated one
     */
    public static String begin(String requestedId) {
        String correlationId = isAcceptable(requestedId) ? requestedId.trim() : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        return correlationId;
    }

    /**
     * Tags the rest of the request with the scope it aggregates over.
     */
    public static void tagScope(AnalyticsScope scope) {
        MDC.put(SCOPE_MDC_KEY, scope.key());
    }

    /**
     * The correlation ID of the current request, or null outside of one.
     */
    public static String currentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static String currentScope() {
        return MDC.get(SCOPE_MDC_KEY);
    }

    /**
     * Ends the context of a request. Pooled threads must not carry it into the next one.
     */
    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(SCOPE_MDC_KEY);
    }

    static boolean isAcceptable(String requestedId) {
        if (requestedId == null) {
            return false;
        }
        String trimmed = requestedId.trim();
        return !trimmed.isEmpty()
            && trimmed.length() <= MAX_CORRELATION_ID_LENGTH
            && SAFE_CORRELATION_ID.matcher(trimmed).matches();
    }

    /**
     * Generates a new correlation ID, shortened for readability in logs.
     */
    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
