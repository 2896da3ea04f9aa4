package com.flowrunner.core.exception;

/**
 * Thrown when stored account credentials exist but cannot be read,
 * e.g. encrypted under another key or not valid JSON once decrypted.
 */
public class CredentialException extends FlowRunnerException {

    public static final String ERROR_CODE = "CREDENTIALS_UNREADABLE";

    public CredentialException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
