package com.naagi.ragflow.checkpoint;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One durable snapshot of a workflow state. Rows are never updated after insert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "workflow_checkpoints", indexes = {
        @Index(name = "idx_workflow_checkpoints_thread", columnList = "thread_id")
})
public class CheckpointEntity {

    @Id
    @Column(name = "checkpoint_id", length = 36)
    private String checkpointId;

    @Column(name = "thread_id", nullable = false)
    private String threadId;

    // null for the first save of a thread
    @Column(name = "parent_checkpoint_id", length = 36)
    private String parentCheckpointId;

    @Lob
    @Column(name = "state_snapshot", nullable = false, columnDefinition = "CLOB")
    private String stateSnapshot;

    @Lob
    @Column(name = "channel_versions", columnDefinition = "CLOB")
    private String channelVersions;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
