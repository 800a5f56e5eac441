package com.naagi.ragflow.checkpoint;

import com.naagi.ragflow.model.WorkflowNode;
import com.naagi.ragflow.model.WorkflowState;

import java.time.Instant;
import java.util.List;

/**
 * Execution trace rebuilt from a checkpoint chain, oldest first.
 */
public record ReplayTrace(String threadId, String checkpointId, List<Step> steps) {

    public ReplayTrace {
        steps = List.copyOf(steps);
    }

    /**
     * @param nextNode  node the workflow was about to run when the checkpoint was written
     * @param newSteps  workflow steps added since the parent checkpoint
     */
    public record Step(
            String checkpointId,
            String parentCheckpointId,
            WorkflowNode nextNode,
            List<String> newSteps,
            WorkflowState state,
            Instant timestamp
    ) {}

    public WorkflowState finalState() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1).state();
    }
}
