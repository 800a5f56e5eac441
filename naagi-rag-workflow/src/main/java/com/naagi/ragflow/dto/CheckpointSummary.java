package com.naagi.ragflow.dto;

import com.naagi.ragflow.checkpoint.CheckpointRecord;
import com.naagi.ragflow.model.WorkflowNode;

import java.time.Instant;
import java.util.Map;

public record CheckpointSummary(
        String checkpointId,
        String threadId,
        String parentCheckpointId,
        WorkflowNode nextNode,
        String question,
        int stepCount,
        int errorCount,
        Map<String, Integer> channelVersions,
        Instant timestamp
) {
    public static CheckpointSummary from(CheckpointRecord record) {
        return new CheckpointSummary(
                record.checkpointId(),
                record.threadId(),
                record.parentCheckpointId(),
                record.state().getNextNode(),
                record.state().getQuestion(),
                record.state().getWorkflowSteps().size(),
                record.state().getErrorMessages().size(),
                record.channelVersions(),
                record.timestamp()
        );
    }
}
