package com.flowrunner.core.model;

/**
 * Outgoing edge of an action node. An edge without a condition always fires.
 */
public record NextAction(
    String actionId,
    String condition
) {
    public static NextAction to(String actionId) {
        return new NextAction(actionId, null);
    }

    public static NextAction when(String actionId, String condition) {
        return new NextAction(actionId, condition);
    }

    public boolean isConditional() {
        return condition != null && !condition.isEmpty();
    }

    /**
     * Check whether this edge fires for the branch condition returned by the operation.
     */
    public boolean firesFor(Object branchCondition) {
        if (!isConditional()) {
            return true;
        }
        return condition.equals(String.valueOf(branchCondition));
    }
}
