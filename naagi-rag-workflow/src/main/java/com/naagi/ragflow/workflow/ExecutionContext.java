package com.naagi.ragflow.workflow;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request execution handle: the activity sink, cancellation flag and every
 * outstanding external call so a cancel can abort them.
 */
@Slf4j
public class ExecutionContext {

    private final String threadId;
    private final ActivitySink activitySink;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final Set<CompletableFuture<?>> outstanding = ConcurrentHashMap.newKeySet();

    public ExecutionContext(String threadId, ActivitySink activitySink) {
        this.threadId = threadId;
        this.activitySink = activitySink == null ? ActivitySink.NOOP : activitySink;
    }

    public static ExecutionContext detached(String threadId) {
        return new ExecutionContext(threadId, ActivitySink.NOOP);
    }

    public String getThreadId() {
        return threadId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Marks the request as abandoned and cancels every call still in flight.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancelSignal.countDown();
            int aborted = 0;
            for (CompletableFuture<?> future : outstanding) {
                if (future.cancel(true)) {
                    aborted++;
                }
            }
            outstanding.clear();
            log.info("[WORKFLOW] Request cancelled thread={} abortedCalls={}", threadId, aborted);
        }
    }

    /**
     * Waits for the given delay unless the request is cancelled first.
     *
     * @return true when the request was cancelled during (or before) the wait
     */
    public boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return cancelled.get();
        }
        try {
            return cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        outstanding.add(future);
        future.whenComplete((value, error) -> outstanding.remove(future));
        if (cancelled.get()) {
            future.cancel(true);
        }
        return future;
    }

    int outstandingCount() {
        return outstanding.size();
    }

    public void activity(String message, String type, Map<String, Object> metadata) {
        try {
            activitySink.log(message, type, metadata == null ? Map.of() : metadata);
        } catch (RuntimeException e) {
            log.debug("[WORKFLOW] Activity sink failed: {}", e.getMessage());
        }
    }

    public void activity(String message) {
        activity(message, "processing", Map.of());
    }
}
