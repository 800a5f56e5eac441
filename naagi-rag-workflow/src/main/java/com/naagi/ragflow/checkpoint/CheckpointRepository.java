package com.naagi.ragflow.checkpoint;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CheckpointRepository extends JpaRepository<CheckpointEntity, String> {

    List<CheckpointEntity> findByThreadIdOrderByTimestampDesc(String threadId);

    @Query("SELECT new com.naagi.ragflow.checkpoint.CheckpointLink(c.checkpointId, c.parentCheckpointId) "
            + "FROM CheckpointEntity c WHERE c.threadId = :threadId ORDER BY c.timestamp DESC")
    List<CheckpointLink> findLinksByThreadId(@Param("threadId") String threadId);

    Optional<CheckpointEntity> findByCheckpointIdAndThreadId(String checkpointId, String threadId);

    long countByThreadId(String threadId);

    @Modifying
    @Query("DELETE FROM CheckpointEntity c WHERE c.threadId = :threadId")
    int deleteByThreadIdBulk(@Param("threadId") String threadId);

    @Modifying
    @Query("DELETE FROM CheckpointEntity c")
    int deleteAllBulk();
}
