package com.flowrunner.runner.integration;

import com.flowrunner.engine.operation.OperationException;
import com.flowrunner.engine.operation.OperationInvoker;
import com.flowrunner.engine.operation.OperationRequest;
import com.flowrunner.engine.operation.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches operation invocations to the registered integration definitions.
 */
public class IntegrationRegistry implements OperationInvoker {

    private static final Logger log = LoggerFactory.getLogger(IntegrationRegistry.class);

    private final Map<String, IntegrationDefinition> definitions = new ConcurrentHashMap<>();

    public IntegrationRegistry(List<IntegrationDefinition> definitions) {
        definitions.forEach(this::register);
    }

    public void register(IntegrationDefinition definition) {
        definitions.put(definition.integrationKey(), definition);
        log.info("Registered integration {} with operations {}",
            definition.integrationKey(), definition.operationKeys());
    }

    @Override
    public OperationResult invoke(OperationRequest request) {
        String integrationKey = request.integration().definitionKey();
        IntegrationDefinition definition = definitions.get(integrationKey);
        if (definition == null) {
            throw new OperationException("Integration definition " + integrationKey + " is not registered");
        }

        String operationKey = request.operation().key();
        OperationHandler handler = definition.findOperation(operationKey)
            .orElseThrow(() -> new OperationException(
                "Integration " + integrationKey + " has no operation " + operationKey));

        log.debug("Running {}.{}", integrationKey, operationKey);
        return handler.run(request);
    }
}
