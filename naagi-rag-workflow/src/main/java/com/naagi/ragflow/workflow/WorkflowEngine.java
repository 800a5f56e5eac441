package com.naagi.ragflow.workflow;

import com.naagi.ragflow.checkpoint.CheckpointStore;
import com.naagi.ragflow.config.WorkflowProperties;
import com.naagi.ragflow.exception.ToolExecutionException;
import com.naagi.ragflow.exception.ValidationException;
import com.naagi.ragflow.exception.WorkflowException;
import com.naagi.ragflow.metrics.WorkflowMetrics;
import com.naagi.ragflow.model.ConversationTurn;
import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.model.SearchStrategy;
import com.naagi.ragflow.model.WorkflowNode;
import com.naagi.ragflow.model.WorkflowOutput;
import com.naagi.ragflow.model.WorkflowState;
import com.naagi.ragflow.quality.QualityAssessment;
import com.naagi.ragflow.quality.RetrievalQualityEvaluator;
import com.naagi.ragflow.rerank.RerankOutcome;
import com.naagi.ragflow.rerank.Reranker;
import com.naagi.ragflow.search.ChunkDeduplicator;
import com.naagi.ragflow.search.ResultFuser;
import com.naagi.ragflow.tools.AnswerGenerator;
import com.naagi.ragflow.tools.CategoryDecision;
import com.naagi.ragflow.tools.CategoryRouter;
import com.naagi.ragflow.tools.EmbeddingService;
import com.naagi.ragflow.tools.KeywordSearch;
import com.naagi.ragflow.tools.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Finite-state machine that answers one question.
 *
 * <pre>
 * VALIDATE -> ROUTE_AND_RETRIEVE -> EVALUATE_QUALITY -> (HYBRID_SEARCH) -> DEDUP -> GENERATE -> FORMAT -> DONE
 *                     \__ retry (widened to "all")          GENERATE -> retry
 * any node -> ERROR
 * </pre>
 *
 * Checkpoints are written after ROUTE_AND_RETRIEVE, after DEDUP and at DONE/ERROR, each with the
 * node to run next, so {@link #run} on a restored state continues from that boundary without
 * repeating completed external calls.
 */
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    static final String CANCELLED_MESSAGE = "Request cancelled";

    static final Map<WorkflowNode, Set<WorkflowNode>> TRANSITIONS;

    static {
        Map<WorkflowNode, Set<WorkflowNode>> table = new EnumMap<>(WorkflowNode.class);
        table.put(WorkflowNode.VALIDATE, EnumSet.of(WorkflowNode.ROUTE_AND_RETRIEVE, WorkflowNode.ERROR));
        table.put(WorkflowNode.ROUTE_AND_RETRIEVE,
                EnumSet.of(WorkflowNode.ROUTE_AND_RETRIEVE, WorkflowNode.EVALUATE_QUALITY, WorkflowNode.ERROR));
        table.put(WorkflowNode.EVALUATE_QUALITY,
                EnumSet.of(WorkflowNode.DEDUP, WorkflowNode.HYBRID_SEARCH, WorkflowNode.ERROR));
        table.put(WorkflowNode.HYBRID_SEARCH, EnumSet.of(WorkflowNode.DEDUP, WorkflowNode.ERROR));
        table.put(WorkflowNode.DEDUP, EnumSet.of(WorkflowNode.GENERATE, WorkflowNode.ERROR));
        table.put(WorkflowNode.GENERATE, EnumSet.of(WorkflowNode.GENERATE, WorkflowNode.FORMAT, WorkflowNode.ERROR));
        table.put(WorkflowNode.FORMAT, EnumSet.of(WorkflowNode.DONE, WorkflowNode.ERROR));
        table.put(WorkflowNode.ERROR, EnumSet.noneOf(WorkflowNode.class));
        table.put(WorkflowNode.DONE, EnumSet.noneOf(WorkflowNode.class));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    private final CategoryRouter categoryRouter;
    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final KeywordSearch keywordSearch;
    private final AnswerGenerator answerGenerator;
    private final RetrievalQualityEvaluator qualityEvaluator;
    private final ResultFuser resultFuser;
    private final Reranker reranker;
    private final FallbackPolicy fallbackPolicy;
    private final ResponseFormatter formatter;
    private final ToolInvoker toolInvoker;
    private final CheckpointStore checkpointStore;
    private final WorkflowMetrics metrics;
    private final WorkflowProperties properties;

    public WorkflowEngine(
            CategoryRouter categoryRouter,
            EmbeddingService embeddingService,
            VectorStore vectorStore,
            KeywordSearch keywordSearch,
            AnswerGenerator answerGenerator,
            RetrievalQualityEvaluator qualityEvaluator,
            ResultFuser resultFuser,
            Reranker reranker,
            FallbackPolicy fallbackPolicy,
            ResponseFormatter formatter,
            ToolInvoker toolInvoker,
            CheckpointStore checkpointStore,
            WorkflowMetrics metrics,
            WorkflowProperties properties
    ) {
        this.categoryRouter = categoryRouter;
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.keywordSearch = keywordSearch;
        this.answerGenerator = answerGenerator;
        this.qualityEvaluator = qualityEvaluator;
        this.resultFuser = resultFuser;
        this.reranker = reranker;
        this.fallbackPolicy = fallbackPolicy;
        this.formatter = formatter;
        this.toolInvoker = toolInvoker;
        this.checkpointStore = checkpointStore;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Drives the state from {@code state.getNextNode()} to a terminal node. Never throws for
     * workflow failures; they end up in the state's error log and the ERROR output.
     */
    public WorkflowOutput run(WorkflowState state, ExecutionContext context) {
        long startTime = System.currentTimeMillis();
        if (state.getStartedAtMillis() == 0L) {
            state.setStartedAtMillis(startTime);
        }
        WorkflowNode node = state.getNextNode();
        String checkpointId = null;
        boolean validationFailure = false;
        boolean cancelled = false;

        log.info("[WORKFLOW] Start thread={} at node={} question='{}'",
                state.getThreadId(), node, truncate(state.getQuestion(), 80));

        while (!node.isTerminal()) {
            WorkflowNode next;
            if (context.isCancelled()) {
                cancelled = true;
                state.addError(CANCELLED_MESSAGE);
                next = WorkflowNode.ERROR;
            } else {
                try {
                    next = execute(node, state, context);
                } catch (CancellationException e) {
                    cancelled = true;
                    state.addError(CANCELLED_MESSAGE);
                    next = WorkflowNode.ERROR;
                } catch (ValidationException e) {
                    validationFailure = true;
                    state.addError(e.toLogEntry());
                    next = WorkflowNode.ERROR;
                } catch (WorkflowException e) {
                    log.warn("[WORKFLOW] {} failed at {}: {}", e.errorType(), node, e.getMessage());
                    state.addError(e.toLogEntry());
                    next = WorkflowNode.ERROR;
                } catch (RuntimeException e) {
                    log.error("[WORKFLOW] Unexpected failure at {}: {}", node, e.getMessage(), e);
                    state.addError("WorkflowError[" + node.channel() + "]: " + e.getMessage());
                    next = WorkflowNode.ERROR;
                }
            }
            requireTransition(node, next);
            log.info("[WORKFLOW] {} -> {}", node, next);
            state.setNextNode(next);
            if (!cancelled && !context.isCancelled() && isSavePoint(node, next)) {
                String saved = checkpoint(state, context);
                checkpointId = saved != null ? saved : checkpointId;
            }
            node = next;
        }

        if (node == WorkflowNode.ERROR && !state.getWorkflowSteps().contains("error")) {
            finishWithError(state, validationFailure);
            if (!cancelled && !context.isCancelled()) {
                String saved = checkpoint(state, context);
                checkpointId = saved != null ? saved : checkpointId;
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        metrics.recordWorkflow(elapsed, node == WorkflowNode.ERROR);
        log.info("[WORKFLOW TIMING] thread={} finished in {}ms state={} retries={} fallback={} errors={}",
                state.getThreadId(), elapsed, node, state.getRetryCount(), state.isFallbackTriggered(),
                state.getErrorMessages().size());
        context.activity(node == WorkflowNode.DONE ? "Answer ready" : "Request failed",
                node == WorkflowNode.DONE ? "success" : "error", Map.of());

        return formatter.toOutput(state, checkpointId, validationFailure);
    }

    private WorkflowNode execute(WorkflowNode node, WorkflowState state, ExecutionContext context) {
        return switch (node) {
            case VALIDATE -> validate(state, context);
            case ROUTE_AND_RETRIEVE -> routeAndRetrieve(state, context);
            case EVALUATE_QUALITY -> evaluateQuality(state, context);
            case HYBRID_SEARCH -> hybridSearch(state, context);
            case DEDUP -> dedup(state, context);
            case GENERATE -> generate(state, context);
            case FORMAT -> format(state, context);
            case ERROR, DONE -> throw new IllegalStateException("Terminal node " + node + " cannot execute");
        };
    }

    static void requireTransition(WorkflowNode from, WorkflowNode to) {
        if (!TRANSITIONS.get(from).contains(to)) {
            throw new IllegalStateException("Undeclared transition " + from + " -> " + to);
        }
    }

    static boolean isSavePoint(WorkflowNode from, WorkflowNode to) {
        if (to == WorkflowNode.DONE) {
            return true;
        }
        return (from == WorkflowNode.ROUTE_AND_RETRIEVE && to == WorkflowNode.EVALUATE_QUALITY)
                || (from == WorkflowNode.DEDUP && to == WorkflowNode.GENERATE);
    }

    // ---------------------------------------------------------------------------------------------
    // Nodes
    // ---------------------------------------------------------------------------------------------

    WorkflowNode validate(WorkflowState state, ExecutionContext context) {
        context.activity("Validating question");
        String question = state.getQuestion().strip();
        if (state.getUserId().isBlank()) {
            throw new ValidationException("User id must not be empty");
        }
        if (question.isEmpty()) {
            throw new ValidationException("Question must not be empty");
        }
        if (question.length() < 5) {
            throw new ValidationException("Question must be at least 5 characters long");
        }
        if (state.getAvailableCategories().isEmpty()) {
            throw new ValidationException("At least one category must be available");
        }
        state.addStep(WorkflowNode.VALIDATE.channel());
        state.log(WorkflowNode.VALIDATE, Map.of(
                "question_length", question.length(),
                "category_count", state.getAvailableCategories().size()));
        return WorkflowNode.ROUTE_AND_RETRIEVE;
    }

    WorkflowNode routeAndRetrieve(WorkflowState state, ExecutionContext context) {
        WorkflowProperties.TimeoutConfig timeouts = properties.getTimeouts();
        try {
            if (!state.isRouted()) {
                context.activity("Selecting document category");
                String conversationContext = summarizeHistory(state.getConversationHistory());
                CategoryDecision decision = toolInvoker.invoke(context, "category_router", timeouts.getRouter(),
                        () -> categoryRouter.route(state.getQuestion(), state.getAvailableCategories(), conversationContext));
                if (decision == null || !state.getAvailableCategories().contains(decision.category())) {
                    String returned = decision == null ? "none" : decision.category();
                    log.warn("[WORKFLOW] Router returned unknown category '{}'", returned);
                    state.addStep("route_unknown_category");
                    return recoverRetrieval(state, context, "router returned unknown category '" + returned + "'");
                }
                state.setRoutedCategory(decision.category());
                state.setCategoryConfidence(decision.confidence());
                state.setCategoryReason(decision.reason());
                state.addStep("route:" + decision.category());
                context.activity("Category selected: " + decision.category(), "info",
                        Map.of("confidence", decision.confidence()));
            }

            if (state.getQuestionEmbedding().isEmpty()) {
                List<Double> embedding = toolInvoker.invoke(context, "embedding", timeouts.getEmbedding(),
                        () -> embeddingService.embed(state.getQuestion()));
                if (embedding == null || embedding.isEmpty()) {
                    throw new ToolExecutionException("embedding", "empty embedding vector");
                }
                state.setQuestionEmbedding(embedding);
            }

            String collection = CollectionNames.forCategory(state.getRoutedCategory());
            int topK = properties.getRetrieval().getTopK();
            List<Double> vector = state.getQuestionEmbedding();
            context.activity("Searching " + collection);
            List<RetrievedChunk> chunks = toolInvoker.invoke(context, "vector_store", timeouts.getVectorSearch(),
                    () -> vectorStore.query(collection, vector, topK));
            List<RetrievedChunk> results = chunks == null ? List.of() : chunks;

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("category", state.getRoutedCategory());
            details.put("confidence", state.getCategoryConfidence());
            details.put("collection", collection);
            details.put("chunk_count", results.size());
            details.put("attempt", state.getRetryCount() + 1);
            state.log(WorkflowNode.ROUTE_AND_RETRIEVE, details);

            if (results.isEmpty() && !state.isWidenedToAll()) {
                state.addStep("retrieve_empty");
                return recoverRetrieval(state, context, "no chunks in " + collection);
            }
            state.setContextChunks(results);
            state.addStep("retrieve:" + results.size());
            return WorkflowNode.EVALUATE_QUALITY;
        } catch (WorkflowException e) {
            if (!fallbackPolicy.isRecoverable(e)) {
                throw e;
            }
            state.addError(e.toLogEntry());
            return recoverRetrieval(state, context, e.getMessage(), true);
        }
    }

    private WorkflowNode recoverRetrieval(WorkflowState state, ExecutionContext context, String reason) {
        return recoverRetrieval(state, context, reason, false);
    }

    private WorkflowNode recoverRetrieval(WorkflowState state, ExecutionContext context, String reason, boolean afterFailure) {
        if (!fallbackPolicy.registerRetry(state, reason)) {
            state.addError("ToolExecutionError[retrieval]: retries exhausted after " + state.getRetryCount() + " retries");
            return WorkflowNode.ERROR;
        }
        metrics.recordRetry();
        if (afterFailure) {
            backoff(state, context);
        }
        if (!state.isWidenedToAll()) {
            fallbackPolicy.widen(state);
            metrics.recordFallback();
            context.activity("Widening search to all categories", "warning", Map.of("reason", reason));
        }
        return WorkflowNode.ROUTE_AND_RETRIEVE;
    }

    WorkflowNode evaluateQuality(WorkflowState state, ExecutionContext context) {
        QualityAssessment assessment = qualityEvaluator.evaluate(state.getContextChunks());
        state.log(WorkflowNode.EVALUATE_QUALITY, assessment.toLogDetails());
        SearchStrategy strategy = assessment.fastPath() ? SearchStrategy.FAST_PATH : SearchStrategy.HYBRID;
        metrics.recordStrategy(strategy);
        // a widened search keeps FALLBACK as its label
        if (state.getSearchStrategy() != SearchStrategy.FALLBACK) {
            state.setSearchStrategy(strategy);
        }
        state.addStep("evaluate_quality:" + strategy.name().toLowerCase());
        if (assessment.fastPath()) {
            context.activity("Retrieval quality sufficient: " + assessment.reason());
            return WorkflowNode.DEDUP;
        }
        context.activity("Retrieval quality low, running hybrid search: " + assessment.reason());
        return WorkflowNode.HYBRID_SEARCH;
    }

    WorkflowNode hybridSearch(WorkflowState state, ExecutionContext context) {
        WorkflowProperties.HybridConfig hybrid = properties.getHybrid();
        WorkflowProperties.TimeoutConfig timeouts = properties.getTimeouts();
        String collection = CollectionNames.forCategory(state.getRoutedCategory());
        String question = state.getQuestion();
        List<Double> vector = state.getQuestionEmbedding();

        CompletableFuture<List<RetrievedChunk>> keywordFuture = toolInvoker.submit(context, "keyword_search",
                timeouts.getKeywordSearch(), () -> keywordSearch.search(collection, question, hybrid.getKeywordTopK()));
        CompletableFuture<List<RetrievedChunk>> semanticFuture =
                hybrid.getSemanticCandidateK() > properties.getRetrieval().getTopK() && !vector.isEmpty()
                        ? toolInvoker.submit(context, "vector_store", timeouts.getVectorSearch(),
                                () -> vectorStore.query(collection, vector, hybrid.getSemanticCandidateK()))
                        : CompletableFuture.completedFuture(state.getContextChunks());

        List<RetrievedChunk> semanticResults;
        try {
            semanticResults = orEmpty(toolInvoker.await(semanticFuture, "vector_store", timeouts.getVectorSearch()));
        } catch (ToolExecutionException e) {
            state.addError(e.toLogEntry());
            semanticResults = state.getContextChunks();
        }
        List<RetrievedChunk> keywordResults;
        try {
            keywordResults = orEmpty(toolInvoker.await(keywordFuture, "keyword_search", timeouts.getKeywordSearch()));
        } catch (ToolExecutionException e) {
            log.warn("[WORKFLOW] Keyword search failed, fusing semantic results only: {}", e.getMessage());
            state.addError(e.toLogEntry());
            keywordResults = List.of();
        }
        state.setKeywordChunks(keywordResults);

        List<RetrievedChunk> fused = resultFuser.fuse(semanticResults, keywordResults, hybrid.getFinalK());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("semantic_count", semanticResults.size());
        details.put("keyword_count", keywordResults.size());
        details.put("fused_count", fused.size());

        if (properties.getRerank().isEnabled() && !fused.isEmpty()) {
            context.activity("Reranking " + fused.size() + " passages");
            RerankOutcome outcome = reranker.rerank(context, question, fused);
            fused = outcome.chunks();
            details.putAll(outcome.toLogDetails());
            state.addStep("rerank");
        }
        state.log(WorkflowNode.HYBRID_SEARCH, details);
        state.setContextChunks(fused);
        state.addStep(WorkflowNode.HYBRID_SEARCH.channel());
        return WorkflowNode.DEDUP;
    }

    WorkflowNode dedup(WorkflowState state, ExecutionContext context) {
        List<RetrievedChunk> before = state.getContextChunks();
        List<RetrievedChunk> after = ChunkDeduplicator.deduplicate(before);
        state.setContextChunks(after);
        state.log(WorkflowNode.DEDUP, Map.of(
                "before", before.size(),
                "after", after.size(),
                "removed", before.size() - after.size()));
        state.addStep(WorkflowNode.DEDUP.channel());
        return WorkflowNode.GENERATE;
    }

    WorkflowNode generate(WorkflowState state, ExecutionContext context) {
        List<RetrievedChunk> chunks = state.getContextChunks();
        if (chunks.isEmpty()) {
            state.setFinalAnswer(formatter.apology(chunks));
            state.addStep("generate:no_context");
            state.log(WorkflowNode.GENERATE, Map.of("generated", false, "reason", "no context"));
            return WorkflowNode.FORMAT;
        }
        context.activity("Generating answer from " + chunks.size() + " passages");
        String historySummary = summarizeHistory(state.getConversationHistory());
        try {
            String answer = toolInvoker.invoke(context, "answer_generator", properties.getTimeouts().getGeneration(),
                    () -> answerGenerator.generate(state.getQuestion(), chunks, historySummary));
            if (answer == null || answer.isBlank()) {
                throw new ToolExecutionException("answer_generator", "empty answer");
            }
            state.setFinalAnswer(answer.strip());
            state.setAnswerGenerated(true);
            state.addStep(WorkflowNode.GENERATE.channel());
            state.log(WorkflowNode.GENERATE, Map.of("generated", true, "answer_length", answer.length()));
            return WorkflowNode.FORMAT;
        } catch (WorkflowException e) {
            if (!fallbackPolicy.isRecoverable(e)) {
                throw e;
            }
            state.addError(e.toLogEntry());
            if (fallbackPolicy.registerRetry(state, e.getMessage())) {
                metrics.recordRetry();
                context.activity("Answer generation failed, retrying", "warning", Map.of());
                backoff(state, context);
                return WorkflowNode.GENERATE;
            }
            state.setFinalAnswer(formatter.apology(chunks));
            state.addStep("generate:degraded");
            state.log(WorkflowNode.GENERATE, Map.of("generated", false, "reason", e.getMessage()));
            return WorkflowNode.FORMAT;
        }
    }

    WorkflowNode format(WorkflowState state, ExecutionContext context) {
        state.setCitationSources(formatter.citations(state.getContextChunks()));
        if (state.getFinalAnswer().isBlank()) {
            state.setFinalAnswer(formatter.apology(state.getContextChunks()));
        }
        state.addStep(WorkflowNode.FORMAT.channel());
        state.log(WorkflowNode.FORMAT, Map.of("citation_count", state.getCitationSources().size()));
        return WorkflowNode.DONE;
    }

    private void finishWithError(WorkflowState state, boolean validationFailure) {
        state.setCitationSources(List.of());
        state.setFinalAnswer(formatter.errorAnswer(state, validationFailure));
        state.addStep("error");
        state.log(WorkflowNode.ERROR, Map.of("error_count", state.getErrorMessages().size()));
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------

    private String checkpoint(WorkflowState state, ExecutionContext context) {
        if (checkpointStore == null || !properties.getCheckpoint().isEnabled() || state.getThreadId().isBlank()) {
            return null;
        }
        if (context.isCancelled()) {
            log.info("[CHECKPOINT] Skipping save for cancelled thread {}", state.getThreadId());
            return null;
        }
        try {
            return checkpointStore.save(state.getThreadId(), state);
        } catch (RuntimeException e) {
            metrics.recordPersistenceFailure();
            String entry = e instanceof WorkflowException we
                    ? we.toLogEntry()
                    : "PersistenceError: " + e.getMessage();
            log.warn("[CHECKPOINT] Save failed for thread {}: {}", state.getThreadId(), e.getMessage());
            state.addError(entry);
            return null;
        }
    }

    private void backoff(WorkflowState state, ExecutionContext context) {
        Duration delay = fallbackPolicy.backoffDelay(state.getRetryCount());
        if (delay.isZero()) {
            return;
        }
        log.debug("[FALLBACK] Waiting {}ms before retry {}", delay.toMillis(), state.getRetryCount());
        if (context.pause(delay)) {
            throw new CancellationException("Request cancelled during retry backoff");
        }
    }

    /**
     * Last turns of the conversation as "role: content" lines.
     */
    String summarizeHistory(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return "";
        }
        int turns = properties.getHistory().getSummaryTurns();
        List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - turns), history.size());
        StringBuilder summary = new StringBuilder();
        for (ConversationTurn turn : recent) {
            if (summary.length() > 0) {
                summary.append('\n');
            }
            summary.append(turn.role().name().toLowerCase()).append(": ").append(truncate(turn.content(), 200));
        }
        return summary.toString();
    }

    private static List<RetrievedChunk> orEmpty(List<RetrievedChunk> chunks) {
        return chunks == null ? List.of() : chunks;
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) return "";
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
