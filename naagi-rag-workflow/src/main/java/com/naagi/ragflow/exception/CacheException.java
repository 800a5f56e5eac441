package com.naagi.ragflow.exception;

public class CacheException extends WorkflowException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "CacheError";
    }
}
