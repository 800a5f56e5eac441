package com.naagi.ragflow.workflow;

import com.naagi.ragflow.exception.ToolExecutionException;
import com.naagi.ragflow.exception.WorkflowException;
import com.naagi.ragflow.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs external calls on the tool executor with a deadline.
 *
 * A timeout or any failure surfaces as {@link ToolExecutionException}; cancellation of the
 * owning request surfaces as {@link CancellationException}. In both the timeout and the
 * cancel case the worker thread running the call is interrupted.
 */
public class ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(ToolInvoker.class);

    private final ExecutorService executor;
    private final WorkflowMetrics metrics;

    public ToolInvoker(ExecutorService executor, WorkflowMetrics metrics) {
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Starts the call without waiting for it.
     */
    public <T> CompletableFuture<T> submit(ExecutionContext context, String tool, Duration timeout, Supplier<T> call) {
        if (context.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Request cancelled before " + tool));
        }
        CompletableFuture<T> future = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            long start = System.currentTimeMillis();
            try {
                future.complete(call.get());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                metrics.recordTool(tool, elapsed);
                log.debug("[TOOL TIMING] {} took {}ms", tool, elapsed);
            }
        });
        // timeout or cancel interrupts the worker still running the call
        future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    if ((error instanceof TimeoutException || error instanceof CancellationException) && !task.isDone()) {
                        task.cancel(true);
                    }
                });
        return context.track(future);
    }

    /**
     * Waits for a submitted call and maps its failure.
     */
    public <T> T await(CompletableFuture<T> future, String tool, Duration timeout) {
        try {
            return future.join();
        } catch (CancellationException e) {
            throw e;
        } catch (CompletionException e) {
            throw translate(tool, timeout, e.getCause() == null ? e : e.getCause());
        }
    }

    public <T> T invoke(ExecutionContext context, String tool, Duration timeout, Supplier<T> call) {
        return await(submit(context, tool, timeout, call), tool, timeout);
    }

    private RuntimeException translate(String tool, Duration timeout, Throwable cause) {
        if (cause instanceof CancellationException cancellation) {
            return cancellation;
        }
        if (cause instanceof TimeoutException) {
            metrics.recordToolFailure(tool, true);
            log.warn("[TOOL] {} timed out after {}ms", tool, timeout.toMillis());
            return ToolExecutionException.timeout(tool, timeout.toMillis());
        }
        metrics.recordToolFailure(tool, false);
        if (cause instanceof WorkflowException workflowFailure) {
            return workflowFailure;
        }
        Throwable root = cause instanceof ExecutionException && cause.getCause() != null ? cause.getCause() : cause;
        log.warn("[TOOL] {} failed: {}", tool, root.getMessage());
        return new ToolExecutionException(tool, root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage(), root);
    }
}
