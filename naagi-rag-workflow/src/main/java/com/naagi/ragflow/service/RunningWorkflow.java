package com.naagi.ragflow.service;

import com.naagi.ragflow.model.WorkflowOutput;
import com.naagi.ragflow.workflow.ExecutionContext;

import java.util.concurrent.CompletableFuture;

/**
 * Handle for a workflow started with {@link QuestionAnsweringService#submit}.
 */
public record RunningWorkflow(String threadId, CompletableFuture<WorkflowOutput> result, ExecutionContext context) {

    /**
     * Abandons the request: outstanding external calls are cancelled and no further
     * checkpoints are written. The result still completes with an ERROR output.
     */
    public void cancel() {
        context.cancel();
    }

    public boolean isCancelled() {
        return context.isCancelled();
    }
}
