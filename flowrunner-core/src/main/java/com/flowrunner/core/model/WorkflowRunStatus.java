package com.flowrunner.core.model;

/**
 * Lifecycle states for a workflow run.
 */
public enum WorkflowRunStatus {
    /**
     * Branches are executing.
     * Transitions: -> SLEEPING, COMPLETED, FAILED
     */
    RUNNING,

    /**
     * Every branch finished but at least one continuation is still pending.
     * Transitions: -> RUNNING (awake)
     */
    SLEEPING,

    /**
     * Every branch reached a terminal state without failures. Terminal state.
     */
    COMPLETED,

    /**
     * The trigger or at least one action failed. Terminal state.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(WorkflowRunStatus target) {
        return switch (this) {
            case RUNNING -> target == SLEEPING || target == COMPLETED || target == FAILED;
            case SLEEPING -> target == RUNNING;
            case COMPLETED, FAILED -> false;
        };
    }
}
