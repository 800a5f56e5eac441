package com.naagi.ragflow.checkpoint;

/**
 * Id and parent id of a checkpoint, without its snapshot columns.
 */
public record CheckpointLink(
        String checkpointId,
        String parentCheckpointId // null for the first checkpoint of a thread
) {}
