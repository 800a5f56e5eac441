package com.naagi.ragflow.checkpoint;

import com.naagi.ragflow.model.WorkflowState;

import java.time.Instant;
import java.util.Map;

/**
 * Decoded checkpoint row.
 */
public record CheckpointRecord(
        String checkpointId,
        String threadId,
        String parentCheckpointId,   // null for the first checkpoint of a thread
        WorkflowState state,
        Map<String, Integer> channelVersions,
        Instant timestamp
) {}
