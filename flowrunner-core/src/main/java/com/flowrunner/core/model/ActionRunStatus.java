package com.flowrunner.core.model;

/**
 * Status of a single action node within a run.
 */
public enum ActionRunStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
