package com.naagi.ragflow.workflow;

import com.naagi.ragflow.checkpoint.CheckpointStore;
import com.naagi.ragflow.config.WorkflowProperties;
import com.naagi.ragflow.exception.PersistenceException;
import com.naagi.ragflow.metrics.WorkflowMetrics;
import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.model.SearchStrategy;
import com.naagi.ragflow.model.WorkflowNode;
import com.naagi.ragflow.model.WorkflowOutput;
import com.naagi.ragflow.model.WorkflowState;
import com.naagi.ragflow.quality.RetrievalQualityEvaluator;
import com.naagi.ragflow.rerank.Reranker;
import com.naagi.ragflow.search.ResultFuser;
import com.naagi.ragflow.tools.AnswerGenerator;
import com.naagi.ragflow.tools.CategoryDecision;
import com.naagi.ragflow.tools.CategoryRouter;
import com.naagi.ragflow.tools.EmbeddingService;
import com.naagi.ragflow.tools.KeywordSearch;
import com.naagi.ragflow.tools.RelevanceScorer;
import com.naagi.ragflow.tools.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WorkflowEngine.
 * External tools and the checkpoint store are mocked; everything else is real.
 */
class WorkflowEngineTest {

    private static final List<Double> VECTOR = List.of(0.1, 0.2, 0.3);

    private CategoryRouter categoryRouter;
    private EmbeddingService embeddingService;
    private VectorStore vectorStore;
    private KeywordSearch keywordSearch;
    private AnswerGenerator answerGenerator;
    private RelevanceScorer relevanceScorer;
    private CheckpointStore checkpointStore;

    private SimpleMeterRegistry registry;
    private WorkflowProperties properties;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        categoryRouter = mock(CategoryRouter.class);
        embeddingService = mock(EmbeddingService.class);
        vectorStore = mock(VectorStore.class);
        keywordSearch = mock(KeywordSearch.class);
        answerGenerator = mock(AnswerGenerator.class);
        relevanceScorer = mock(RelevanceScorer.class);
        checkpointStore = mock(CheckpointStore.class);

        registry = new SimpleMeterRegistry();
        properties = new WorkflowProperties();
        properties.getRetry().setInitialDelay(Duration.ZERO);
        executor = Executors.newFixedThreadPool(4);

        when(checkpointStore.save(anyString(), any(WorkflowState.class))).thenReturn("cp-1", "cp-2", "cp-3", "cp-4");
        when(categoryRouter.route(anyString(), anyList(), anyString()))
                .thenReturn(new CategoryDecision("hr", 0.9, "leave policy question"));
        when(embeddingService.embed(anyString())).thenReturn(VECTOR);
        when(answerGenerator.generate(anyString(), anyList(), anyString())).thenReturn("You get 25 days of leave [1].");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private WorkflowEngine newEngine() {
        WorkflowMetrics metrics = new WorkflowMetrics(registry);
        ToolInvoker toolInvoker = new ToolInvoker(executor, metrics);
        return new WorkflowEngine(
                categoryRouter,
                embeddingService,
                vectorStore,
                keywordSearch,
                answerGenerator,
                new RetrievalQualityEvaluator(
                        properties.getQuality().getFastPathMinChunks(),
                        properties.getQuality().getFastPathMinSimilarity()),
                new ResultFuser(properties.getHybrid().getSemanticWeight(), properties.getHybrid().getKeywordWeight()),
                new Reranker(relevanceScorer, toolInvoker, properties.getTimeouts().getScoring()),
                new FallbackPolicy(properties.getRetry().getMaxRetries(),
                        properties.getRetry().getInitialDelay(), properties.getRetry().getBackoffFactor()),
                new ResponseFormatter(properties.getFormat().getPreviewLength()),
                toolInvoker,
                checkpointStore,
                metrics,
                properties);
    }

    private static WorkflowState newState(String question) {
        return WorkflowState.builder()
                .threadId("thread-1")
                .sessionId("session-1")
                .userId("user-1")
                .question(question)
                .availableCategories(new ArrayList<>(List.of("hr", "legal")))
                .build();
    }

    private static List<RetrievedChunk> chunks(double... scores) {
        List<RetrievedChunk> chunks = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            chunks.add(RetrievedChunk.of("handbook.pdf", i, "Leave policy passage " + i, scores[i]));
        }
        return chunks;
    }

    @Nested
    @DisplayName("Happy paths")
    class HappyPathTests {

        @Test
        @DisplayName("Good semantic results take the fast path and skip keyword search")
        void fastPath() {
            // given
            when(vectorStore.query(eq("cat_hr"), anyList(), eq(5))).thenReturn(chunks(0.9, 0.85, 0.8));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.finalAnswer()).isEqualTo("You get 25 days of leave [1].");
            assertThat(output.routedCategory()).isEqualTo("hr");
            assertThat(output.searchStrategy()).isEqualTo(SearchStrategy.FAST_PATH);
            assertThat(output.citationSources()).hasSize(3);
            assertThat(output.errorMessages()).isEmpty();
            assertThat(output.fallbackTriggered()).isFalse();
            assertThat(output.workflowSteps()).containsExactly(
                    "validate", "route:hr", "retrieve:3", "evaluate_quality:fast_path", "dedup", "generate", "format");
            assertThat(output.checkpointId()).isEqualTo("cp-3");
            assertThat(state.getNextNode()).isEqualTo(WorkflowNode.DONE);
            assertThat(state.isAnswerGenerated()).isTrue();
            verify(checkpointStore, times(3)).save(eq("thread-1"), any(WorkflowState.class));
            verifyNoInteractions(keywordSearch, relevanceScorer);
        }

        @Test
        @DisplayName("Weak semantic results run hybrid search with reranking")
        void hybridPath() {
            // given
            when(vectorStore.query(eq("cat_hr"), anyList(), eq(5))).thenReturn(chunks(0.4, 0.35));
            when(keywordSearch.search(eq("cat_hr"), anyString(), eq(10)))
                    .thenReturn(List.of(RetrievedChunk.of("policy.pdf", 7, "Vacation days accrue monthly", 1.0)));
            when(relevanceScorer.score(anyString(), any(RetrievedChunk.class))).thenReturn("80");
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.searchStrategy()).isEqualTo(SearchStrategy.HYBRID);
            assertThat(output.workflowSteps())
                    .contains("evaluate_quality:hybrid", "rerank", "hybrid_search", "dedup", "generate", "format");
            assertThat(output.citationSources()).hasSize(3);
            assertThat(state.getKeywordChunks()).hasSize(1);
            verify(relevanceScorer, times(3)).score(anyString(), any(RetrievedChunk.class));
            // semanticCandidateK equals topK, so no second vector query
            verify(vectorStore, times(1)).query(anyString(), anyList(), anyInt());
        }

        @Test
        @DisplayName("Keyword search failure fuses the semantic results alone")
        void keywordFailure() {
            // given
            when(vectorStore.query(eq("cat_hr"), anyList(), eq(5))).thenReturn(chunks(0.4));
            when(keywordSearch.search(anyString(), anyString(), anyInt())).thenThrow(new IllegalStateException("index offline"));
            properties.getRerank().setEnabled(false);
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.finalAnswer()).isEqualTo("You get 25 days of leave [1].");
            assertThat(output.errorMessages()).containsExactly("ToolExecutionError[keyword_search]: index offline");
            assertThat(output.citationSources()).hasSize(1);
            assertThat(output.workflowSteps()).doesNotContain("rerank");
        }

        @Test
        @DisplayName("A state restored at GENERATE does not repeat retrieval")
        void resumeFromGenerate() {
            // given
            WorkflowState state = newState("How many vacation days do I get?");
            state.setRoutedCategory("hr");
            state.setContextChunks(chunks(0.9, 0.8));
            state.setNextNode(WorkflowNode.GENERATE);

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.finalAnswer()).isEqualTo("You get 25 days of leave [1].");
            assertThat(output.workflowSteps()).containsExactly("generate", "format");
            verifyNoInteractions(categoryRouter, embeddingService, vectorStore);
        }
    }

    @Nested
    @DisplayName("Fallback and retries")
    class FallbackTests {

        @Test
        @DisplayName("Empty category collection widens the search to all categories")
        void emptyCategoryWidens() {
            // given
            when(vectorStore.query(eq("cat_hr"), anyList(), anyInt())).thenReturn(List.of());
            when(vectorStore.query(eq("all"), anyList(), anyInt())).thenReturn(chunks(0.9, 0.85, 0.8));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            ArgumentCaptor<String> collections = ArgumentCaptor.forClass(String.class);
            verify(vectorStore, times(2)).query(collections.capture(), anyList(), anyInt());
            assertThat(collections.getAllValues()).containsExactly("cat_hr", "all");
            verify(categoryRouter, times(1)).route(anyString(), anyList(), anyString());
            verify(embeddingService, times(1)).embed(anyString());

            assertThat(output.fallbackTriggered()).isTrue();
            assertThat(output.retryCount()).isEqualTo(1);
            assertThat(output.routedCategory()).isEqualTo("all");
            assertThat(output.searchStrategy()).isEqualTo(SearchStrategy.FALLBACK);
            assertThat(output.errorMessages()).isEmpty();
            assertThat(output.workflowSteps()).containsSubsequence("retrieve_empty", "retry_1", "fallback_widened", "retrieve:3");
            assertThat(registry.get("ragflow.fallback.total").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A transient embedding failure is retried once and logged once")
        void transientToolFailure() {
            // given
            when(embeddingService.embed(anyString()))
                    .thenThrow(new IllegalStateException("connection reset"))
                    .thenReturn(VECTOR);
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenReturn(chunks(0.9, 0.85, 0.8));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.retryCount()).isEqualTo(1);
            assertThat(output.errorMessages()).hasSize(1);
            assertThat(output.errorMessages().get(0)).startsWith("ToolExecutionError[embedding]");
            assertThat(output.finalAnswer()).isEqualTo("You get 25 days of leave [1].");
            assertThat(state.getNextNode()).isEqualTo(WorkflowNode.DONE);
        }

        @Test
        @DisplayName("A node runs at most maxRetries + 1 times")
        void retryBound() {
            // given
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenThrow(new IllegalStateException("qdrant down"));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            verify(vectorStore, times(properties.getRetry().getMaxRetries() + 1)).query(anyString(), anyList(), anyInt());
            assertThat(output.retryCount()).isEqualTo(properties.getRetry().getMaxRetries());
            assertThat(output.finalAnswer()).isEqualTo(ResponseFormatter.GENERIC_APOLOGY);
            assertThat(output.workflowSteps()).endsWith("error");
            assertThat(output.citationSources()).isEmpty();
            assertThat(state.getNextNode()).isEqualTo(WorkflowNode.ERROR);
            verifyNoInteractions(answerGenerator);
        }

        @Test
        @DisplayName("Router picking a category outside the available set widens to all")
        void unknownCategory() {
            // given
            when(categoryRouter.route(anyString(), anyList(), anyString()))
                    .thenReturn(new CategoryDecision("finance", 0.7, "guess"));
            when(vectorStore.query(eq("all"), anyList(), anyInt())).thenReturn(chunks(0.9, 0.85, 0.8));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.routedCategory()).isEqualTo("all");
            assertThat(output.workflowSteps()).contains("route_unknown_category", "fallback_widened");
            verify(categoryRouter, times(1)).route(anyString(), anyList(), anyString());
            verify(vectorStore, never()).query(eq("cat_finance"), anyList(), anyInt());
        }

        @Test
        @DisplayName("Generation that keeps timing out degrades to an apology with passages")
        void generationTimeout() {
            // given
            properties.getTimeouts().setGeneration(Duration.ofMillis(100));
            properties.getRetry().setMaxRetries(1);
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenReturn(chunks(0.9, 0.85, 0.8));
            when(answerGenerator.generate(anyString(), anyList(), anyString())).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return "too late";
            });
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.errorMessages()).hasSize(2)
                    .allSatisfy(error -> assertThat(error).contains("answer_generator").contains("timed out"));
            assertThat(output.workflowSteps()).contains("retry_1", "generate:degraded", "format");
            assertThat(output.finalAnswer()).contains("[1] handbook.pdf");
            assertThat(state.isAnswerGenerated()).isFalse();
            assertThat(state.getNextNode()).isEqualTo(WorkflowNode.DONE);
        }

        @Test
        @DisplayName("Empty results after widening answer with the generic apology without generating")
        void emptyEverywhere() {
            // given
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenReturn(List.of());
            properties.getRerank().setEnabled(false);
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            verify(vectorStore, times(2)).query(anyString(), anyList(), anyInt());
            assertThat(output.finalAnswer()).isEqualTo(ResponseFormatter.GENERIC_APOLOGY);
            assertThat(output.workflowSteps()).contains("generate:no_context");
            verifyNoInteractions(answerGenerator);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Short question fails validation without external calls")
        void validationFailure() {
            // given
            WorkflowState state = newState("hi");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.finalAnswer()).isEqualTo("Question must be at least 5 characters long");
            assertThat(output.errorMessages()).containsExactly("Question must be at least 5 characters long");
            assertThat(output.routedCategory()).isNull();
            assertThat(output.searchStrategy()).isNull();
            assertThat(output.workflowSteps()).containsExactly("error");
            verifyNoInteractions(categoryRouter, embeddingService, vectorStore, answerGenerator);
        }

        @Test
        @DisplayName("Missing categories fail validation")
        void noCategories() {
            WorkflowState state = newState("How many vacation days do I get?");
            state.setAvailableCategories(List.of());

            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            assertThat(output.finalAnswer()).isEqualTo("At least one category must be available");
        }

        @Test
        @DisplayName("Cancelled request stops before the next external call and saves nothing")
        void cancellation() {
            // given
            ExecutionContext context = ExecutionContext.detached("thread-1");
            when(categoryRouter.route(anyString(), anyList(), anyString())).thenAnswer(invocation -> {
                context.cancel();
                return new CategoryDecision("hr", 0.9, "leave");
            });
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, context);

            // then
            assertThat(output.errorMessages()).containsExactly(WorkflowEngine.CANCELLED_MESSAGE);
            assertThat(state.getNextNode()).isEqualTo(WorkflowNode.ERROR);
            verifyNoInteractions(embeddingService, vectorStore);
            verify(checkpointStore, never()).save(anyString(), any(WorkflowState.class));
        }

        @Test
        @DisplayName("Cancel arriving after a call returned skips the pending save point")
        void cancelAfterCallReturned() {
            // given
            AtomicBoolean searchReturned = new AtomicBoolean(false);
            ExecutionContext context = new ExecutionContext("thread-1", ActivitySink.NOOP) {
                @Override
                public boolean isCancelled() {
                    return searchReturned.get() || super.isCancelled();
                }
            };
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenAnswer(invocation -> {
                searchReturned.set(true);
                return chunks(0.9, 0.85, 0.8);
            });
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, context);

            // then
            assertThat(output.errorMessages()).containsExactly(WorkflowEngine.CANCELLED_MESSAGE);
            assertThat(output.checkpointId()).isNull();
            verify(checkpointStore, never()).save(anyString(), any(WorkflowState.class));
            verifyNoInteractions(answerGenerator);
        }

        @Test
        @DisplayName("Non-recoverable workflow failures inside a node are not retried")
        void persistenceFailureInsideNodeNotRetried() {
            // given
            when(embeddingService.embed(anyString())).thenThrow(new PersistenceException("embedding cache unavailable"));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            verify(embeddingService, times(1)).embed(anyString());
            assertThat(output.retryCount()).isZero();
            assertThat(state.getNextNode()).isEqualTo(WorkflowNode.ERROR);
        }

        @Test
        @DisplayName("Checkpoint failures are logged and do not abort the request")
        void persistenceFailure() {
            // given
            reset(checkpointStore);
            when(checkpointStore.save(anyString(), any(WorkflowState.class)))
                    .thenThrow(new PersistenceException("database is locked"));
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenReturn(chunks(0.9, 0.85, 0.8));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.finalAnswer()).isEqualTo("You get 25 days of leave [1].");
            assertThat(output.checkpointId()).isNull();
            assertThat(output.errorMessages()).hasSize(3).allMatch(e -> e.startsWith("PersistenceError"));
            assertThat(registry.get("ragflow.checkpoint.failures").counter().count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Checkpointing can be switched off")
        void checkpointDisabled() {
            properties.getCheckpoint().setEnabled(false);
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenReturn(chunks(0.9, 0.85, 0.8));

            WorkflowOutput output = newEngine().run(newState("How many vacation days do I get?"),
                    ExecutionContext.detached("thread-1"));

            assertThat(output.checkpointId()).isNull();
            verifyNoInteractions(checkpointStore);
        }
    }

    @Nested
    @DisplayName("Retry backoff")
    class BackoffTests {

        @Test
        @DisplayName("Retries after a tool failure wait initialDelay * factor^(n-1)")
        void exponentialBackoff() {
            // given
            properties.getRetry().setInitialDelay(Duration.ofMillis(100));
            properties.getRetry().setBackoffFactor(2.0);
            when(vectorStore.query(anyString(), anyList(), anyInt()))
                    .thenThrow(new IllegalStateException("qdrant down"))
                    .thenThrow(new IllegalStateException("qdrant down"))
                    .thenReturn(chunks(0.9, 0.85, 0.8));
            WorkflowState state = newState("How many vacation days do I get?");

            // when
            long start = System.currentTimeMillis();
            WorkflowOutput output = newEngine().run(state, ExecutionContext.detached("thread-1"));
            long elapsed = System.currentTimeMillis() - start;

            // then
            assertThat(output.retryCount()).isEqualTo(2);
            assertThat(output.finalAnswer()).isEqualTo("You get 25 days of leave [1].");
            assertThat(elapsed).isGreaterThanOrEqualTo(300L);
        }

        @Test
        @DisplayName("Empty results widen immediately without waiting")
        void noBackoffForEmptyResults() {
            // given
            properties.getRetry().setInitialDelay(Duration.ofSeconds(10));
            when(vectorStore.query(eq("cat_hr"), anyList(), anyInt())).thenReturn(List.of());
            when(vectorStore.query(eq("all"), anyList(), anyInt())).thenReturn(chunks(0.9, 0.85, 0.8));

            // when
            long start = System.currentTimeMillis();
            WorkflowOutput output = newEngine().run(newState("How many vacation days do I get?"),
                    ExecutionContext.detached("thread-1"));

            // then
            assertThat(output.fallbackTriggered()).isTrue();
            assertThat(System.currentTimeMillis() - start).isLessThan(5_000L);
        }

        @Test
        @DisplayName("Cancelling during the wait ends the request without another attempt")
        void cancelDuringBackoff() throws Exception {
            // given
            properties.getRetry().setInitialDelay(Duration.ofSeconds(30));
            when(vectorStore.query(anyString(), anyList(), anyInt())).thenThrow(new IllegalStateException("qdrant down"));
            ExecutionContext context = ExecutionContext.detached("thread-1");
            WorkflowState state = newState("How many vacation days do I get?");
            ExecutorService caller = Executors.newSingleThreadExecutor();

            try {
                // when
                Future<WorkflowOutput> running = caller.submit(() -> newEngine().run(state, context));
                Thread.sleep(300);
                context.cancel();
                WorkflowOutput output = running.get(5, TimeUnit.SECONDS);

                // then
                assertThat(output.errorMessages()).endsWith(WorkflowEngine.CANCELLED_MESSAGE);
                assertThat(output.retryCount()).isEqualTo(1);
                verify(vectorStore, times(1)).query(anyString(), anyList(), anyInt());
            } finally {
                caller.shutdownNow();
            }
        }

        @Test
        @DisplayName("An interrupted wait keeps the interrupt flag and reports cancellation")
        void interruptedPauseRestoresFlag() {
            ExecutionContext context = ExecutionContext.detached("thread-1");
            Thread.currentThread().interrupt();
            try {
                assertThat(context.pause(Duration.ofSeconds(5))).isTrue();
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("Transition table")
    class TransitionTests {

        @Test
        @DisplayName("Every node declares its successors and terminals have none")
        void tableComplete() {
            for (WorkflowNode node : WorkflowNode.values()) {
                assertThat(WorkflowEngine.TRANSITIONS).containsKey(node);
            }
            assertThat(WorkflowEngine.TRANSITIONS.get(WorkflowNode.DONE)).isEmpty();
            assertThat(WorkflowEngine.TRANSITIONS.get(WorkflowNode.ERROR)).isEmpty();
        }

        @Test
        @DisplayName("Every non-terminal node can reach ERROR")
        void errorReachable() {
            for (WorkflowNode node : WorkflowNode.values()) {
                if (!node.isTerminal()) {
                    assertThat(WorkflowEngine.TRANSITIONS.get(node)).contains(WorkflowNode.ERROR);
                }
            }
        }

        @Test
        @DisplayName("Undeclared transitions are rejected")
        void undeclaredTransition() {
            assertThatThrownBy(() -> WorkflowEngine.requireTransition(WorkflowNode.GENERATE, WorkflowNode.VALIDATE))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> WorkflowEngine.requireTransition(WorkflowNode.DONE, WorkflowNode.FORMAT))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Save points follow retrieval, dedup and completion")
        void savePoints() {
            assertThat(WorkflowEngine.isSavePoint(WorkflowNode.ROUTE_AND_RETRIEVE, WorkflowNode.EVALUATE_QUALITY)).isTrue();
            assertThat(WorkflowEngine.isSavePoint(WorkflowNode.DEDUP, WorkflowNode.GENERATE)).isTrue();
            assertThat(WorkflowEngine.isSavePoint(WorkflowNode.FORMAT, WorkflowNode.DONE)).isTrue();
            assertThat(WorkflowEngine.isSavePoint(WorkflowNode.ROUTE_AND_RETRIEVE, WorkflowNode.ROUTE_AND_RETRIEVE)).isFalse();
            assertThat(WorkflowEngine.isSavePoint(WorkflowNode.VALIDATE, WorkflowNode.ROUTE_AND_RETRIEVE)).isFalse();
        }
    }
}
