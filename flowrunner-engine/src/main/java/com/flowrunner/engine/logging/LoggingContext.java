package com.flowrunner.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forAction(workflowId, runId, actionId)) {
 *     log.info("Invoking operation"); // Automatically includes workflowId, runId, actionId
 * }
 * </pre>
 *
 * MDC is thread-bound, so each branch opens its own context on the thread executing it.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String RUN_ID = "runId";
    public static final String ACTION_ID = "actionId";
    public static final String TRIGGER_ID = "triggerId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for run-level operations.
     */
    public static LoggingContext forRun(String workflowId, String runId) {
        LoggingContext ctx = new LoggingContext();
        put(WORKFLOW_ID, workflowId);
        put(RUN_ID, runId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for a single action node.
     */
    public static LoggingContext forAction(String workflowId, String runId, String actionId) {
        LoggingContext ctx = forRun(workflowId, runId);
        put(ACTION_ID, actionId);
        return ctx;
    }

    /**
     * Create a logging context for a trigger check.
     */
    public static LoggingContext forTrigger(String workflowId, String triggerId) {
        LoggingContext ctx = new LoggingContext();
        put(WORKFLOW_ID, workflowId);
        put(TRIGGER_ID, triggerId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the run ID once the trigger check has created its run.
     */
    public static void setRunId(String runId) {
        put(RUN_ID, runId);
    }

    public static String getWorkflowId() {
        return MDC.get(WORKFLOW_ID);
    }

    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(RUN_ID);
        MDC.remove(ACTION_ID);
        MDC.remove(TRIGGER_ID);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a scheduler tick.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
