package com.naagi.ragflow.model;

import java.util.List;

/**
 * Structured result of one answered question.
 */
public record WorkflowOutput(
        String finalAnswer,
        List<CitationSource> citationSources,
        List<String> workflowSteps,
        List<String> errorMessages,
        String routedCategory,
        SearchStrategy searchStrategy,
        boolean fallbackTriggered,
        boolean fromCache,
        int retryCount,
        String threadId,
        String checkpointId
) {
    public WorkflowOutput {
        finalAnswer = finalAnswer == null ? "" : finalAnswer;
        citationSources = citationSources == null ? List.of() : List.copyOf(citationSources);
        workflowSteps = workflowSteps == null ? List.of() : List.copyOf(workflowSteps);
        errorMessages = errorMessages == null ? List.of() : List.copyOf(errorMessages);
    }

    public static WorkflowOutput fromCache(String answer, String threadId) {
        return new WorkflowOutput(answer, List.of(), List.of("cache_lookup", "cache_hit"), List.of(),
                null, null, false, true, 0, threadId, null);
    }
}
