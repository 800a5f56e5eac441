package com.naagi.ragflow.metrics;

import com.naagi.ragflow.model.SearchStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the question-answering workflow.
 * Exposed to Prometheus through the actuator endpoint.
 */
@Component
public class WorkflowMetrics {

    private final MeterRegistry registry;

    // Timers
    private final Timer workflowTimer;

    // Counters
    private final Counter workflowCounter;
    private final Counter workflowErrorCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter fallbackCounter;
    private final Counter retryCounter;
    private final Counter fastPathCounter;
    private final Counter hybridCounter;
    private final Counter persistenceFailureCounter;

    private volatile long lastWorkflowTimeMs = 0;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.workflowTimer = Timer.builder("ragflow.workflow.duration")
                .description("Total workflow duration")
                .tags("operation", "answer")
                .register(registry);

        this.workflowCounter = Counter.builder("ragflow.workflow.total")
                .description("Number of workflow executions")
                .tags("operation", "answer")
                .register(registry);

        this.workflowErrorCounter = Counter.builder("ragflow.workflow.errors")
                .description("Number of workflows that ended in the ERROR state")
                .tags("operation", "answer")
                .register(registry);

        this.cacheHitCounter = Counter.builder("ragflow.cache.hits")
                .description("Number of answers served from the conversation cache")
                .tags("cache", "conversation")
                .register(registry);

        this.cacheMissCounter = Counter.builder("ragflow.cache.misses")
                .description("Number of conversation cache misses")
                .tags("cache", "conversation")
                .register(registry);

        this.fallbackCounter = Counter.builder("ragflow.fallback.total")
                .description("Number of category widenings to all categories")
                .register(registry);

        this.retryCounter = Counter.builder("ragflow.retry.total")
                .description("Number of node retries")
                .register(registry);

        this.fastPathCounter = Counter.builder("ragflow.strategy.total")
                .description("Quality decisions that kept the semantic results")
                .tags("strategy", "fast_path")
                .register(registry);

        this.hybridCounter = Counter.builder("ragflow.strategy.total")
                .description("Quality decisions that escalated to hybrid search")
                .tags("strategy", "hybrid")
                .register(registry);

        this.persistenceFailureCounter = Counter.builder("ragflow.checkpoint.failures")
                .description("Checkpoint writes that failed")
                .register(registry);
    }

    public void recordTool(String tool, long durationMs) {
        Timer.builder("ragflow.tool.duration")
                .description("Duration of external tool calls")
                .tags("tool", tool)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordToolFailure(String tool, boolean timeout) {
        Counter.builder("ragflow.tool.failures")
                .description("Failed external tool calls")
                .tags("tool", tool, "timeout", String.valueOf(timeout))
                .register(registry)
                .increment();
    }

    public void recordWorkflow(long durationMs, boolean error) {
        workflowTimer.record(durationMs, TimeUnit.MILLISECONDS);
        workflowCounter.increment();
        if (error) {
            workflowErrorCounter.increment();
        }
        lastWorkflowTimeMs = durationMs;
    }

    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    public void recordFallback() {
        fallbackCounter.increment();
    }

    public void recordRetry() {
        retryCounter.increment();
    }

    public void recordStrategy(SearchStrategy strategy) {
        if (strategy == SearchStrategy.FAST_PATH) {
            fastPathCounter.increment();
        } else {
            hybridCounter.increment();
        }
    }

    public void recordPersistenceFailure() {
        persistenceFailureCounter.increment();
    }

    public long getLastWorkflowTimeMs() {
        return lastWorkflowTimeMs;
    }
}
