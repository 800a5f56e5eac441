package com.naagi.ragflow.exception;

/**
 * Base type for failures raised inside the question-answering workflow.
 * The engine converts these into entries of the state's error log; they never
 * escape {@code QuestionAnsweringService.answerQuestion}.
 */
public abstract class WorkflowException extends RuntimeException {

    protected WorkflowException(String message) {
        super(message);
    }

    protected WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Taxonomy label used as the prefix of error log entries.
     */
    public abstract String errorType();

    public String toLogEntry() {
        return errorType() + ": " + getMessage();
    }
}
