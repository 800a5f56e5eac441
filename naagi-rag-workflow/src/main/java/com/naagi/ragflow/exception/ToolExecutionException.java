package com.naagi.ragflow.exception;

/**
 * Failure of an external call (router, embeddings, vector/keyword search, generation, scoring).
 * Recoverable up to the configured retry bound.
 */
public class ToolExecutionException extends WorkflowException {

    private final String toolName;
    private final boolean timeout;

    public ToolExecutionException(String toolName, String message) {
        this(toolName, message, null, false);
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        this(toolName, message, cause, false);
    }

    public ToolExecutionException(String toolName, String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.toolName = toolName;
        this.timeout = timeout;
    }

    public static ToolExecutionException timeout(String toolName, long timeoutMillis) {
        return new ToolExecutionException(toolName, "timed out after " + timeoutMillis + "ms", null, true);
    }

    public String getToolName() {
        return toolName;
    }

    public boolean isTimeout() {
        return timeout;
    }

    @Override
    public String errorType() {
        return "ToolExecutionError";
    }

    @Override
    public String toLogEntry() {
        return errorType() + "[" + toolName + "]: " + getMessage();
    }
}
