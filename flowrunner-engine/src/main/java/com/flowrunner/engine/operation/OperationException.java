package com.flowrunner.engine.operation;

import com.flowrunner.core.exception.FlowRunnerException;

/**
 * Thrown when an external operation fails. Carries the raw response text when available.
 */
public class OperationException extends FlowRunnerException {

    public static final String ERROR_CODE = "OPERATION_FAILED";

    private final String responseText;

    public OperationException(String message) {
        this(message, null, null);
    }

    public OperationException(String message, String responseText) {
        this(message, responseText, null);
    }

    public OperationException(String message, String responseText, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.responseText = responseText;
    }

    public String getResponseText() {
        return responseText;
    }
}
