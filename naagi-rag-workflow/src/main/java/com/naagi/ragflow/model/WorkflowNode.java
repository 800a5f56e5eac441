package com.naagi.ragflow.model;

/**
 * Nodes of the question-answering state machine.
 */
public enum WorkflowNode {
    VALIDATE,
    ROUTE_AND_RETRIEVE,
    EVALUATE_QUALITY,
    HYBRID_SEARCH,
    DEDUP,
    GENERATE,
    FORMAT,
    ERROR,
    DONE;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    /**
     * Name used for channel versions and observability entries.
     */
    public String channel() {
        return name().toLowerCase();
    }
}
