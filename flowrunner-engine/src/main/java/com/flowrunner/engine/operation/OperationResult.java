package com.flowrunner.engine.operation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;

/**
 * Result of an operation invocation.
 * 
 * condition selects outgoing edges; sleepUntil suspends the branch;
 * refreshedCredentials replaces stored secrets after a token refresh.
 */
public record OperationResult(
    JsonNode outputs,
    JsonNode condition,
    Instant sleepUntil,
    ObjectNode refreshedCredentials
) {
    public static OperationResult of(JsonNode outputs) {
        return new OperationResult(outputs, null, null, null);
    }

    public static OperationResult withCondition(JsonNode outputs, JsonNode condition) {
        return new OperationResult(outputs, condition, null, null);
    }

    public static OperationResult sleeping(JsonNode outputs, Instant sleepUntil) {
        return new OperationResult(outputs, null, sleepUntil, null);
    }

    public boolean isSleep() {
        return sleepUntil != null;
    }

    /**
     * String form of the branch condition, compared against edge conditions.
     */
    public String conditionText() {
        if (condition == null || condition.isMissingNode()) {
            return "undefined";
        }
        return condition.isContainerNode() ? condition.toString() : condition.asText();
    }
}
