package com.naagi.ragflow.exception;

/**
 * Malformed input. Terminal, never retried; the message is shown to the caller as is.
 */
public class ValidationException extends WorkflowException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "ValidationError";
    }

    @Override
    public String toLogEntry() {
        return getMessage();
    }
}
