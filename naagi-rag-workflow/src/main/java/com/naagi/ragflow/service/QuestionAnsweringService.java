package com.naagi.ragflow.service;

import com.naagi.ragflow.cache.CacheLookup;
import com.naagi.ragflow.cache.ConversationCache;
import com.naagi.ragflow.checkpoint.CheckpointRecord;
import com.naagi.ragflow.checkpoint.CheckpointStore;
import com.naagi.ragflow.checkpoint.ReplayTrace;
import com.naagi.ragflow.config.WorkflowProperties;
import com.naagi.ragflow.exception.CacheException;
import com.naagi.ragflow.exception.PersistenceException;
import com.naagi.ragflow.metrics.WorkflowMetrics;
import com.naagi.ragflow.model.ConversationTurn;
import com.naagi.ragflow.model.WorkflowOutput;
import com.naagi.ragflow.model.WorkflowState;
import com.naagi.ragflow.workflow.ActivitySink;
import com.naagi.ragflow.workflow.ExecutionContext;
import com.naagi.ragflow.workflow.ResponseFormatter;
import com.naagi.ragflow.workflow.WorkflowEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for answering questions: conversation cache first, then the workflow engine.
 * Also exposes checkpoint resume/replay and session reset.
 */
@Service
@Slf4j
public class QuestionAnsweringService {

    private final WorkflowEngine engine;
    private final ConversationCache cache;
    private final CheckpointStore checkpointStore;
    private final ResponseFormatter formatter;
    private final WorkflowMetrics metrics;
    private final WorkflowProperties properties;
    private final ExecutorService requestExecutor;

    public QuestionAnsweringService(
            WorkflowEngine engine,
            ConversationCache cache,
            CheckpointStore checkpointStore,
            ResponseFormatter formatter,
            WorkflowMetrics metrics,
            WorkflowProperties properties,
            @Qualifier("workflowRequestExecutor") ExecutorService requestExecutor
    ) {
        this.engine = engine;
        this.cache = cache;
        this.checkpointStore = checkpointStore;
        this.formatter = formatter;
        this.metrics = metrics;
        this.properties = properties;
        this.requestExecutor = requestExecutor;
    }

    /**
     * Answers a question in the user's own session; the user id doubles as session and thread id.
     */
    public WorkflowOutput answerQuestion(String userId, String question, List<String> availableCategories,
                                         List<ConversationTurn> history, ActivitySink activitySink) {
        return answerQuestion(userId, userId, question, availableCategories, history, activitySink);
    }

    public WorkflowOutput answerQuestion(String userId, String sessionId, String question,
                                         List<String> availableCategories, List<ConversationTurn> history,
                                         ActivitySink activitySink) {
        String threadId = threadIdFor(userId, sessionId);
        return answer(userId, threadId, question, availableCategories, history,
                new ExecutionContext(threadId, activitySink));
    }

    /**
     * Starts the request on the request executor and returns a cancellable handle.
     */
    public RunningWorkflow submit(String userId, String sessionId, String question, List<String> availableCategories,
                                  List<ConversationTurn> history, ActivitySink activitySink) {
        String threadId = threadIdFor(userId, sessionId);
        ExecutionContext context = new ExecutionContext(threadId, activitySink);
        CompletableFuture<WorkflowOutput> result = CompletableFuture.supplyAsync(
                () -> answer(userId, threadId, question, availableCategories, history, context), requestExecutor);
        return new RunningWorkflow(threadId, result, context);
    }

    private WorkflowOutput answer(String userId, String threadId, String question, List<String> availableCategories,
                                  List<ConversationTurn> history, ExecutionContext context) {
        List<ConversationTurn> turns = history == null ? List.of() : history;

        Optional<String> cached = lookupCache(threadId, question, turns);
        if (cached.isPresent()) {
            context.activity("Answer served from conversation cache", "success", Map.of());
            return WorkflowOutput.fromCache(cached.get(), threadId);
        }

        WorkflowState state = WorkflowState.builder()
                .threadId(threadId)
                .sessionId(threadId)
                .userId(userId == null ? "" : userId)
                .question(question == null ? "" : question)
                .conversationHistory(new ArrayList<>(turns))
                .availableCategories(availableCategories == null ? new ArrayList<>() : new ArrayList<>(availableCategories))
                .build();
        state.addStep("cache_lookup");

        WorkflowOutput output = engine.run(state, context);
        if (state.isAnswerGenerated() && !context.isCancelled()) {
            recordCache(threadId, question, output.finalAnswer());
        }
        return output;
    }

    /**
     * Continues the workflow from a saved checkpoint. A checkpoint saved at a terminal node
     * returns its stored output without running anything.
     */
    public Optional<WorkflowOutput> resume(String checkpointId, String threadId, ActivitySink activitySink) {
        Optional<CheckpointRecord> record = checkpointStore.get(threadId, checkpointId);
        if (record.isEmpty()) {
            log.warn("[CHECKPOINT] Resume requested for unknown checkpoint {} in thread {}", checkpointId, threadId);
            return Optional.empty();
        }
        WorkflowState state = record.get().state();
        log.info("[CHECKPOINT] Resuming thread={} from {} at node={}", threadId, record.get().checkpointId(), state.getNextNode());
        if (state.getNextNode().isTerminal()) {
            return Optional.of(formatter.toOutput(state, record.get().checkpointId(), false));
        }
        WorkflowOutput output = engine.run(state, new ExecutionContext(threadId, activitySink));
        if (state.isAnswerGenerated()) {
            recordCache(threadId, state.getQuestion(), output.finalAnswer());
        }
        return Optional.of(output);
    }

    /**
     * Rebuilds the execution trace up to the checkpoint from stored snapshots only.
     */
    public Optional<ReplayTrace> replay(String checkpointId, String threadId) {
        String target = checkpointId;
        if (target == null || target.isBlank()) {
            Optional<CheckpointRecord> latest = checkpointStore.latest(threadId);
            if (latest.isEmpty()) {
                return Optional.empty();
            }
            target = latest.get().checkpointId();
        }
        List<CheckpointRecord> chain = checkpointStore.chain(threadId, target);
        if (chain.isEmpty()) {
            return Optional.empty();
        }
        List<ReplayTrace.Step> steps = new ArrayList<>(chain.size());
        int previousStepCount = 0;
        String previousQuestion = null;
        for (CheckpointRecord record : chain) {
            WorkflowState state = record.state();
            List<String> allSteps = state.getWorkflowSteps();
            // a new question in the same thread starts its own step log
            int from = state.getQuestion().equals(previousQuestion) && previousStepCount <= allSteps.size()
                    ? previousStepCount : 0;
            steps.add(new ReplayTrace.Step(
                    record.checkpointId(),
                    record.parentCheckpointId(),
                    state.getNextNode(),
                    List.copyOf(allSteps.subList(from, allSteps.size())),
                    state,
                    record.timestamp()));
            previousStepCount = allSteps.size();
            previousQuestion = state.getQuestion();
        }
        log.info("[CHECKPOINT] Replayed {} checkpoints for thread {}", steps.size(), threadId);
        return Optional.of(new ReplayTrace(threadId, target, steps));
    }

    public List<CheckpointRecord> listCheckpoints(String threadId) {
        return checkpointStore.list(threadId);
    }

    public Optional<CheckpointRecord> getCheckpoint(String threadId, String checkpointId) {
        return checkpointStore.get(threadId, checkpointId);
    }

    public int clearCheckpoints(String threadId) {
        return checkpointStore.clear(threadId);
    }

    /**
     * Forgets a session's cached answers and, when asked, its checkpoint thread.
     */
    public SessionReset resetSession(String sessionId, boolean clearCheckpoints) {
        int cacheRemoved = 0;
        try {
            cacheRemoved = cache.resetSession(sessionId);
        } catch (CacheException e) {
            log.warn("[CACHE] Reset failed for session {}: {}", sessionId, e.getMessage());
        }
        int checkpointsRemoved = 0;
        if (clearCheckpoints) {
            try {
                checkpointsRemoved = checkpointStore.clear(sessionId);
            } catch (PersistenceException e) {
                log.warn("[CHECKPOINT] Clear failed for session {}: {}", sessionId, e.getMessage());
            }
        }
        log.info("[CACHE] Session {} reset: cacheEntries={}, checkpoints={}", sessionId, cacheRemoved, checkpointsRemoved);
        return new SessionReset(sessionId, cacheRemoved, checkpointsRemoved);
    }

    private Optional<String> lookupCache(String sessionId, String question, List<ConversationTurn> history) {
        if (!properties.getCache().isEnabled() || question == null || question.isBlank()) {
            return Optional.empty();
        }
        try {
            CacheLookup lookup = cache.lookup(sessionId, question, history);
            if (lookup.isHit()) {
                metrics.recordCacheHit();
                log.info("[CACHE] {} hit for session {} (similarity={})",
                        lookup.matchType(), sessionId, String.format("%.3f", lookup.similarity()));
                return Optional.of(lookup.answer());
            }
            metrics.recordCacheMiss();
            return Optional.empty();
        } catch (CacheException e) {
            log.warn("[CACHE] Lookup failed, treating as miss: {}", e.getMessage());
            metrics.recordCacheMiss();
            return Optional.empty();
        }
    }

    private void recordCache(String sessionId, String question, String answer) {
        if (!properties.getCache().isEnabled()) {
            return;
        }
        try {
            cache.record(sessionId, question, answer);
        } catch (CacheException e) {
            log.warn("[CACHE] Record failed, answer not cached: {}", e.getMessage());
        }
    }

    private static String threadIdFor(String userId, String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            return sessionId;
        }
        return userId == null ? "" : userId;
    }
}
