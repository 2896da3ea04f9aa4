package com.flowrunner.core.exception;

/**
 * Thrown when a templated input cannot be resolved against the output bag.
 */
public class InvalidInputsException extends FlowRunnerException {

    public static final String ERROR_CODE = "INVALID_INPUTS";

    public InvalidInputsException(String message) {
        super(ERROR_CODE, message);
    }

    public InvalidInputsException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
