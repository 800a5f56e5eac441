package com.naagi.ragflow.config;

import com.naagi.ragflow.cache.ConversationCache;
import com.naagi.ragflow.cache.LevenshteinSimilarityMatcher;
import com.naagi.ragflow.cache.SimilarityMatcher;
import com.naagi.ragflow.checkpoint.CheckpointStore;
import com.naagi.ragflow.metrics.WorkflowMetrics;
import com.naagi.ragflow.quality.RetrievalQualityEvaluator;
import com.naagi.ragflow.rerank.Reranker;
import com.naagi.ragflow.search.ResultFuser;
import com.naagi.ragflow.tools.AnswerGenerator;
import com.naagi.ragflow.tools.CategoryRouter;
import com.naagi.ragflow.tools.EmbeddingService;
import com.naagi.ragflow.tools.KeywordSearch;
import com.naagi.ragflow.tools.RelevanceScorer;
import com.naagi.ragflow.tools.VectorStore;
import com.naagi.ragflow.workflow.FallbackPolicy;
import com.naagi.ragflow.workflow.ResponseFormatter;
import com.naagi.ragflow.workflow.ToolInvoker;
import com.naagi.ragflow.workflow.WorkflowEngine;
import org.springframework.beans.factory.annotation.Qualifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class WorkflowConfig {

    // external calls only; whole requests run on workflowRequestExecutor
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workflowExecutor(WorkflowProperties properties) {
        int poolSize = Math.max(2, properties.getExecutor().getPoolSize());
        log.info("[WORKFLOW] Tool executor initialized with {} threads", poolSize);
        return Executors.newFixedThreadPool(poolSize, daemonThreads("workflow-tool-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workflowRequestExecutor(WorkflowProperties properties) {
        int poolSize = Math.max(1, properties.getExecutor().getRequestPoolSize());
        log.info("[WORKFLOW] Request executor initialized with {} threads", poolSize);
        return Executors.newFixedThreadPool(poolSize, daemonThreads("workflow-request-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Bean
    public ToolInvoker toolInvoker(@Qualifier("workflowExecutor") ExecutorService workflowExecutor, WorkflowMetrics metrics) {
        return new ToolInvoker(workflowExecutor, metrics);
    }

    @Bean
    public SimilarityMatcher similarityMatcher() {
        return new LevenshteinSimilarityMatcher();
    }

    @Bean
    public ConversationCache conversationCache(SimilarityMatcher similarityMatcher, WorkflowProperties properties) {
        WorkflowProperties.CacheConfig cache = properties.getCache();
        return new ConversationCache(similarityMatcher, cache.getCapacity(), cache.getSimilarityThreshold());
    }

    @Bean
    public ResultFuser resultFuser(WorkflowProperties properties) {
        WorkflowProperties.HybridConfig hybrid = properties.getHybrid();
        return new ResultFuser(hybrid.getSemanticWeight(), hybrid.getKeywordWeight());
    }

    @Bean
    public FallbackPolicy fallbackPolicy(WorkflowProperties properties) {
        WorkflowProperties.RetryConfig retry = properties.getRetry();
        return new FallbackPolicy(retry.getMaxRetries(), retry.getInitialDelay(), retry.getBackoffFactor());
    }

    @Bean
    public RetrievalQualityEvaluator retrievalQualityEvaluator(WorkflowProperties properties) {
        WorkflowProperties.QualityConfig quality = properties.getQuality();
        return new RetrievalQualityEvaluator(quality.getFastPathMinChunks(), quality.getFastPathMinSimilarity());
    }

    @Bean
    public Reranker reranker(RelevanceScorer relevanceScorer, ToolInvoker toolInvoker, WorkflowProperties properties) {
        return new Reranker(relevanceScorer, toolInvoker, properties.getTimeouts().getScoring());
    }

    @Bean
    public ResponseFormatter responseFormatter(WorkflowProperties properties) {
        return new ResponseFormatter(properties.getFormat().getPreviewLength());
    }

    @Bean
    public WorkflowEngine workflowEngine(
            CategoryRouter categoryRouter,
            EmbeddingService embeddingService,
            VectorStore vectorStore,
            KeywordSearch keywordSearch,
            AnswerGenerator answerGenerator,
            RetrievalQualityEvaluator qualityEvaluator,
            ResultFuser resultFuser,
            Reranker reranker,
            FallbackPolicy fallbackPolicy,
            ResponseFormatter responseFormatter,
            ToolInvoker toolInvoker,
            CheckpointStore checkpointStore,
            WorkflowMetrics metrics,
            WorkflowProperties properties
    ) {
        log.info("[WORKFLOW] Engine initialized: maxRetries={}, topK={}, rerank={}, checkpoints={}",
                properties.getRetry().getMaxRetries(), properties.getRetrieval().getTopK(),
                properties.getRerank().isEnabled(), properties.getCheckpoint().isEnabled());
        return new WorkflowEngine(categoryRouter, embeddingService, vectorStore, keywordSearch, answerGenerator,
                qualityEvaluator, resultFuser, reranker, fallbackPolicy, responseFormatter, toolInvoker,
                checkpointStore, metrics, properties);
    }
}
