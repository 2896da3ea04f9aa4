package com.flowrunner.runner.integration;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The operations of one integration, keyed by operation key.
 * 
 * Usage:
 * <pre>
 * public class ChatDefinition extends IntegrationDefinition {
 *     public ChatDefinition() {
 *         registerOperation("sendMessage", request -> OperationResult.of(send(request.inputs())));
 *     }
 *
 *     public String integrationKey() { return "chat"; }
 * }
 * </pre>
 */
public abstract class IntegrationDefinition {

    private final Map<String, OperationHandler> operations = new ConcurrentHashMap<>();

    /**
     * Key matched against {@link com.flowrunner.core.model.Integration#definitionKey()}.
     */
    public abstract String integrationKey();

    protected void registerOperation(String operationKey, OperationHandler handler) {
        operations.put(operationKey, handler);
    }

    public Optional<OperationHandler> findOperation(String operationKey) {
        return Optional.ofNullable(operations.get(operationKey));
    }

    public Set<String> operationKeys() {
        return Set.copyOf(operations.keySet());
    }
}
