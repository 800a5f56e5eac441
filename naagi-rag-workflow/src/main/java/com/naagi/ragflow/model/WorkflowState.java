package com.naagi.ragflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable record threaded through every workflow node.
 *
 * <p>Every field carries an explicit default; collections are never null and the
 * setters below coerce a null argument to an empty value. {@code fallbackTriggered}
 * can only go from false to true and {@code retryCount} never decreases.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowState {

    public static final String ALL_CATEGORIES = "all";

    @Builder.Default
    private String threadId = "";

    @Builder.Default
    private String sessionId = "";

    @Builder.Default
    private String userId = "";

    @Builder.Default
    private String question = "";

    @Builder.Default
    private List<ConversationTurn> conversationHistory = new ArrayList<>();

    @Builder.Default
    private List<String> availableCategories = new ArrayList<>();

    /**
     * Empty until routing ran; afterwards a member of availableCategories or "all".
     */
    @Builder.Default
    private String routedCategory = "";

    @Builder.Default
    private double categoryConfidence = 0.0;

    @Builder.Default
    private String categoryReason = "";

    @Builder.Default
    private List<Double> questionEmbedding = new ArrayList<>();

    @Builder.Default
    private List<RetrievedChunk> contextChunks = new ArrayList<>();

    @Builder.Default
    private List<RetrievedChunk> keywordChunks = new ArrayList<>();

    @Builder.Default
    private SearchStrategy searchStrategy = SearchStrategy.FAST_PATH;

    @Builder.Default
    private int retryCount = 0;

    @Builder.Default
    private boolean fallbackTriggered = false;

    @Builder.Default
    private List<String> workflowSteps = new ArrayList<>();

    @Builder.Default
    private List<String> errorMessages = new ArrayList<>();

    @Builder.Default
    private List<Map<String, Object>> workflowLogs = new ArrayList<>();

    @Builder.Default
    private String finalAnswer = "";

    @Builder.Default
    private boolean answerGenerated = false;

    @Builder.Default
    private List<CitationSource> citationSources = new ArrayList<>();

    /**
     * Node to run next; persisted with every checkpoint so a resume knows where to continue.
     */
    @Builder.Default
    private WorkflowNode nextNode = WorkflowNode.VALIDATE;

    @Builder.Default
    private long startedAtMillis = 0L;

    public void setFallbackTriggered(boolean fallbackTriggered) {
        this.fallbackTriggered = this.fallbackTriggered || fallbackTriggered;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = Math.max(this.retryCount, retryCount);
    }

    public void setThreadId(String threadId) {
        this.threadId = threadId == null ? "" : threadId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId == null ? "" : sessionId;
    }

    public void setUserId(String userId) {
        this.userId = userId == null ? "" : userId;
    }

    public void setQuestion(String question) {
        this.question = question == null ? "" : question;
    }

    public void setRoutedCategory(String routedCategory) {
        this.routedCategory = routedCategory == null ? "" : routedCategory;
    }

    public void setCategoryReason(String categoryReason) {
        this.categoryReason = categoryReason == null ? "" : categoryReason;
    }

    public void setFinalAnswer(String finalAnswer) {
        this.finalAnswer = finalAnswer == null ? "" : finalAnswer;
    }

    public void setSearchStrategy(SearchStrategy searchStrategy) {
        this.searchStrategy = searchStrategy == null ? SearchStrategy.FAST_PATH : searchStrategy;
    }

    public void setNextNode(WorkflowNode nextNode) {
        this.nextNode = nextNode == null ? WorkflowNode.VALIDATE : nextNode;
    }

    public void setConversationHistory(List<ConversationTurn> conversationHistory) {
        this.conversationHistory = mutable(conversationHistory);
    }

    public void setAvailableCategories(List<String> availableCategories) {
        this.availableCategories = mutable(availableCategories);
    }

    public void setQuestionEmbedding(List<Double> questionEmbedding) {
        this.questionEmbedding = mutable(questionEmbedding);
    }

    public void setContextChunks(List<RetrievedChunk> contextChunks) {
        this.contextChunks = mutable(contextChunks);
    }

    public void setKeywordChunks(List<RetrievedChunk> keywordChunks) {
        this.keywordChunks = mutable(keywordChunks);
    }

    public void setWorkflowSteps(List<String> workflowSteps) {
        this.workflowSteps = mutable(workflowSteps);
    }

    public void setErrorMessages(List<String> errorMessages) {
        this.errorMessages = mutable(errorMessages);
    }

    public void setWorkflowLogs(List<Map<String, Object>> workflowLogs) {
        this.workflowLogs = mutable(workflowLogs);
    }

    public void setCitationSources(List<CitationSource> citationSources) {
        this.citationSources = mutable(citationSources);
    }

    @JsonIgnore
    public boolean isRouted() {
        return !routedCategory.isEmpty();
    }

    @JsonIgnore
    public boolean isWidenedToAll() {
        return ALL_CATEGORIES.equals(routedCategory);
    }

    public void addStep(String step) {
        workflowSteps.add(step);
    }

    public void addError(String message) {
        errorMessages.add(message);
    }

    /**
     * Append an observability entry for a node.
     */
    public void log(WorkflowNode node, Map<String, Object> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("node", node.channel());
        entry.put("timestamp", Instant.now().toString());
        if (details != null) {
            entry.putAll(details);
        }
        workflowLogs.add(entry);
    }

    private static <T> List<T> mutable(List<T> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
