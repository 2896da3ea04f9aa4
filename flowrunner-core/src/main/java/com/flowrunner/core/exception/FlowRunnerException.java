package com.flowrunner.core.exception;

/**
 * Base exception for all flowrunner errors.
 */
public class FlowRunnerException extends RuntimeException {
    
    private final String errorCode;
    
    public FlowRunnerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public FlowRunnerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
