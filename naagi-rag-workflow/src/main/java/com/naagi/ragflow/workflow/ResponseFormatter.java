package com.naagi.ragflow.workflow;

import com.naagi.ragflow.model.CitationSource;
import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.model.WorkflowOutput;
import com.naagi.ragflow.model.WorkflowState;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds citations, apology answers and the final {@link WorkflowOutput}.
 */
public class ResponseFormatter {

    static final String GENERIC_APOLOGY =
            "I'm sorry, I could not find a reliable answer to your question. Please try rephrasing it.";
    static final int APOLOGY_PREVIEWS = 3;

    private final int previewLength;

    public ResponseFormatter(int previewLength) {
        this.previewLength = previewLength;
    }

    public List<CitationSource> citations(List<RetrievedChunk> chunks) {
        List<CitationSource> citations = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            citations.add(new CitationSource(i + 1, chunk.source(), chunk.distance(), preview(chunk.content())));
        }
        return citations;
    }

    public String preview(String content) {
        String text = content == null ? "" : content.strip();
        if (text.length() <= previewLength) {
            return text;
        }
        return text.substring(0, previewLength) + "...";
    }

    /**
     * Degraded answer used when generation failed for good. Lists the best passages
     * that were found, if any.
     */
    public String apology(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return GENERIC_APOLOGY;
        }
        StringBuilder answer = new StringBuilder(
                "I'm sorry, I could not generate an answer right now. These passages may help:");
        int limit = Math.min(APOLOGY_PREVIEWS, chunks.size());
        for (int i = 0; i < limit; i++) {
            RetrievedChunk chunk = chunks.get(i);
            answer.append("\n[").append(i + 1).append("] ")
                    .append(chunk.source()).append(": ")
                    .append(preview(chunk.content()));
        }
        return answer.toString();
    }

    /**
     * User-safe message for the ERROR state. Validation messages are shown verbatim.
     */
    public String errorAnswer(WorkflowState state, boolean validationFailure) {
        if (validationFailure && !state.getErrorMessages().isEmpty()) {
            return state.getErrorMessages().get(state.getErrorMessages().size() - 1);
        }
        return GENERIC_APOLOGY;
    }

    public WorkflowOutput toOutput(WorkflowState state, String checkpointId, boolean validationFailure) {
        boolean routed = state.isRouted() && !validationFailure;
        return new WorkflowOutput(
                state.getFinalAnswer(),
                state.getCitationSources(),
                state.getWorkflowSteps(),
                state.getErrorMessages(),
                routed ? state.getRoutedCategory() : null,
                routed ? state.getSearchStrategy() : null,
                state.isFallbackTriggered(),
                false,
                state.getRetryCount(),
                state.getThreadId(),
                checkpointId
        );
    }
}
