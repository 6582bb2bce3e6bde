package com.versioning.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Puts the ids an operation works on into every log line it emits.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forDraft(draftId, userId)) {
 *     log.info("Updating draft"); // includes draftId, userId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String DRAFT_ID = "draftId";
    public static final String RESOURCE_ID = "resourceId";
    public static final String USER_ID = "userId";
    public static final String GROUP_ID = "groupId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Context for operations on one draft.
     */
    public static LoggingContext forDraft(Long draftId, Long userId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(DRAFT_ID, draftId);
        putIfPresent(USER_ID, userId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Context for creating a draft or resource on behalf of a user in a group.
     */
    public static LoggingContext forAuthor(Long userId, Long groupId, Long resourceId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(USER_ID, userId);
        putIfPresent(GROUP_ID, groupId);
        putIfPresent(RESOURCE_ID, resourceId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Context for operations on one resource.
     */
    public static LoggingContext forResource(long resourceId) {
        LoggingContext ctx = new LoggingContext();
        MDC.put(RESOURCE_ID, String.valueOf(resourceId));
        ensureTraceId();
        return ctx;
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, Long value) {
        if (value != null) {
            MDC.put(key, value.toString());
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(DRAFT_ID);
        MDC.remove(RESOURCE_ID);
        MDC.remove(USER_ID);
        MDC.remove(GROUP_ID);
        // TRACE_ID stays for the rest of the request
    }

    /**
     * Clear all MDC context at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
