package com.flowrunner.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowRunStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(WorkflowRunStatus.COMPLETED.isTerminal());
        assertTrue(WorkflowRunStatus.FAILED.isTerminal());
        
        assertFalse(WorkflowRunStatus.RUNNING.isTerminal());
        assertFalse(WorkflowRunStatus.SLEEPING.isTerminal());
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowSleepingCompletedFailed() {
        assertTrue(WorkflowRunStatus.RUNNING.canTransitionTo(WorkflowRunStatus.SLEEPING));
        assertTrue(WorkflowRunStatus.RUNNING.canTransitionTo(WorkflowRunStatus.COMPLETED));
        assertTrue(WorkflowRunStatus.RUNNING.canTransitionTo(WorkflowRunStatus.FAILED));
        
        assertFalse(WorkflowRunStatus.RUNNING.canTransitionTo(WorkflowRunStatus.RUNNING));
    }

    @Test
    void canTransitionTo_fromSleeping_shouldOnlyAllowAwake() {
        assertTrue(WorkflowRunStatus.SLEEPING.canTransitionTo(WorkflowRunStatus.RUNNING));
        
        assertFalse(WorkflowRunStatus.SLEEPING.canTransitionTo(WorkflowRunStatus.COMPLETED));
        assertFalse(WorkflowRunStatus.SLEEPING.canTransitionTo(WorkflowRunStatus.FAILED));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (WorkflowRunStatus target : WorkflowRunStatus.values()) {
            assertFalse(WorkflowRunStatus.COMPLETED.canTransitionTo(target));
            assertFalse(WorkflowRunStatus.FAILED.canTransitionTo(target));
        }
    }

    @Test
    void withStatus_shouldStampFinishedAtOnlyForTerminalStates() {
        WorkflowRun run = WorkflowRun.create("user-1", "wf-1", WorkflowRunStartedBy.USER);
        
        assertNull(run.withStatus(WorkflowRunStatus.SLEEPING).finishedAt());
        assertNotNull(run.withStatus(WorkflowRunStatus.COMPLETED).finishedAt());
    }
}
