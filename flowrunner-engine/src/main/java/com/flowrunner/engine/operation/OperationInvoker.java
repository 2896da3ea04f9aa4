package com.flowrunner.engine.operation;

/**
 * Executes one trigger poll or one action against an integration.
 * Implementations own transport, retries and timeouts.
 */
public interface OperationInvoker {

    /**
     * @param request The operation and its resolved inputs and credentials
     * @return Outputs, optional branch condition and optional wake instant
     * @throws OperationException if the external call fails
     */
    OperationResult invoke(OperationRequest request);
}
