package com.flowrunner.runner.integration;

import com.flowrunner.engine.operation.OperationException;
import com.flowrunner.engine.operation.OperationRequest;
import com.flowrunner.engine.operation.OperationResult;

/**
 * Implementation of a single trigger or action operation.
 */
@FunctionalInterface
public interface OperationHandler {

    /**
     * Run the operation.
     * 
     * @param request Resolved inputs and credentials
     * @return The operation result
     * @throws OperationException if the external call fails
     */
    OperationResult run(OperationRequest request) throws OperationException;
}
