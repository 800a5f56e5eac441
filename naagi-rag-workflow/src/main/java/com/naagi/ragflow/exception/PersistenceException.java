package com.naagi.ragflow.exception;

/**
 * Checkpoint read/write failure. Logged into the error log; never aborts a request.
 */
public class PersistenceException extends WorkflowException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "PersistenceError";
    }
}
