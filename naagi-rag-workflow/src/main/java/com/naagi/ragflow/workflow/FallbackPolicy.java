package com.naagi.ragflow.workflow;

import com.naagi.ragflow.exception.ToolExecutionException;
import com.naagi.ragflow.exception.ValidationException;
import com.naagi.ragflow.model.SearchStrategy;
import com.naagi.ragflow.model.WorkflowState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Retry and category-widening rules for one request.
 *
 * <ul>
 *   <li>At most {@code maxRetries} retries per request, shared by retrieval and generation.</li>
 *   <li>Only recoverable tool failures and empty results trigger a retry, never validation failures.</li>
 *   <li>Widening to "all" categories is permanent for the rest of the request.</li>
 *   <li>A retry after a tool failure waits {@code initialDelay * backoffFactor^(n-1)} before attempt n.</li>
 * </ul>
 */
@Slf4j
public class FallbackPolicy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final double backoffFactor;

    public FallbackPolicy(int maxRetries, Duration initialDelay, double backoffFactor) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1");
        }
        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.backoffFactor = backoffFactor;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isRecoverable(Throwable failure) {
        if (failure instanceof ValidationException) {
            return false;
        }
        return failure instanceof ToolExecutionException;
    }

    /**
     * Wait before the given retry attempt (1-based).
     */
    public Duration backoffDelay(int attempt) {
        if (attempt < 1 || initialDelay.isZero()) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, Long.MAX_VALUE));
    }

    public boolean canRetry(WorkflowState state) {
        return state.getRetryCount() < maxRetries;
    }

    /**
     * Consumes one retry from the request budget.
     *
     * @return true when the retry is within the bound and the node may run again
     */
    public boolean registerRetry(WorkflowState state, String reason) {
        if (!canRetry(state)) {
            log.info("[FALLBACK] Retries exhausted ({}/{}): {}", state.getRetryCount(), maxRetries, reason);
            return false;
        }
        state.setRetryCount(state.getRetryCount() + 1);
        state.addStep("retry_" + state.getRetryCount());
        log.info("[FALLBACK] Retry {}/{}: {}", state.getRetryCount(), maxRetries, reason);
        return true;
    }

    /**
     * Widens the search to every category. Calling it again has no further effect.
     */
    public void widen(WorkflowState state) {
        if (state.isFallbackTriggered() && state.isWidenedToAll()) {
            return;
        }
        String previous = state.getRoutedCategory();
        state.setRoutedCategory(WorkflowState.ALL_CATEGORIES);
        state.setFallbackTriggered(true);
        state.setSearchStrategy(SearchStrategy.FALLBACK);
        state.addStep("fallback_widened");
        log.info("[FALLBACK] Widened category '{}' -> '{}'", previous, WorkflowState.ALL_CATEGORIES);
    }
}
