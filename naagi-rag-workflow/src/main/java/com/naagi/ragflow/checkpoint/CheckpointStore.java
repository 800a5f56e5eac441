package com.naagi.ragflow.checkpoint;

import com.naagi.ragflow.exception.PersistenceException;
import com.naagi.ragflow.model.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-scoped, parent-linked workflow snapshots.
 *
 * <p>Writes for one thread id are serialized with a lock striped on the thread id, so each new
 * record's parent is the previous save of the same thread and every chain stays linear. Reads
 * take no lock. Finding the chain head reads only the id columns.
 * Ordering follows the parent links rather than the timestamp column, which can tie for
 * saves in the same instant.
 */
@Service
@Slf4j
public class CheckpointStore {

    private static final int LOCK_STRIPES = 64;

    private final CheckpointRepository repository;
    private final ReentrantLock[] threadLocks = new ReentrantLock[LOCK_STRIPES];

    public CheckpointStore(CheckpointRepository repository) {
        this.repository = repository;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            threadLocks[i] = new ReentrantLock();
        }
    }

    /**
     * @return the id of the new checkpoint
     */
    public String save(String threadId, WorkflowState state) {
        requireThread(threadId);
        ReentrantLock lock = lockFor(threadId);
        lock.lock();
        try {
            String parentId = headId(repository.findLinksByThreadId(threadId)).orElse(null);
            CheckpointEntity entity = CheckpointEntity.builder()
                    .checkpointId(UUID.randomUUID().toString())
                    .threadId(threadId)
                    .parentCheckpointId(parentId)
                    .stateSnapshot(StateSnapshotCodec.encodeState(state))
                    .channelVersions(StateSnapshotCodec.encodeVersions(channelVersions(state)))
                    .timestamp(Instant.now())
                    .build();
            repository.save(entity);
            log.debug("[CHECKPOINT] Saved {} thread={} parent={} next={}",
                    entity.getCheckpointId(), threadId, parentId, state.getNextNode());
            return entity.getCheckpointId();
        } catch (DataAccessException e) {
            throw new PersistenceException("Checkpoint save failed for thread " + threadId + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param checkpointId a specific checkpoint, or null for the latest of the thread
     */
    public Optional<CheckpointRecord> get(String threadId, String checkpointId) {
        requireThread(threadId);
        try {
            if (checkpointId == null || checkpointId.isBlank()) {
                return headId(repository.findLinksByThreadId(threadId))
                        .flatMap(headId -> repository.findByCheckpointIdAndThreadId(headId, threadId))
                        .map(this::toRecord);
            }
            return repository.findByCheckpointIdAndThreadId(checkpointId, threadId).map(this::toRecord);
        } catch (DataAccessException e) {
            throw new PersistenceException("Checkpoint read failed for thread " + threadId + ": " + e.getMessage(), e);
        }
    }

    public Optional<CheckpointRecord> latest(String threadId) {
        return get(threadId, null);
    }

    /**
     * All checkpoints of a thread, newest first.
     */
    public List<CheckpointRecord> list(String threadId) {
        requireThread(threadId);
        try {
            return orderNewestFirst(repository.findByThreadIdOrderByTimestampDesc(threadId)).stream()
                    .map(this::toRecord)
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceException("Checkpoint list failed for thread " + threadId + ": " + e.getMessage(), e);
        }
    }

    /**
     * The checkpoint and its ancestors, oldest first.
     */
    public List<CheckpointRecord> chain(String threadId, String checkpointId) {
        requireThread(threadId);
        try {
            Map<String, String> parentOf = new HashMap<>();
            for (CheckpointLink link : repository.findLinksByThreadId(threadId)) {
                parentOf.put(link.checkpointId(), link.parentCheckpointId());
            }
            LinkedList<String> ids = new LinkedList<>();
            Set<String> visited = new HashSet<>();
            String currentId = checkpointId;
            while (currentId != null && parentOf.containsKey(currentId) && visited.add(currentId)) {
                ids.addFirst(currentId);
                currentId = parentOf.get(currentId);
            }
            Map<String, CheckpointEntity> byId = new HashMap<>();
            repository.findAllById(ids).forEach(entity -> byId.put(entity.getCheckpointId(), entity));
            return ids.stream()
                    .map(byId::get)
                    .filter(Objects::nonNull)
                    .map(this::toRecord)
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceException("Checkpoint chain failed for thread " + threadId + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param threadId thread to clear, or null to clear every thread
     * @return number of deleted checkpoints
     */
    @Transactional
    public int clear(String threadId) {
        try {
            if (threadId == null || threadId.isBlank()) {
                int deleted = repository.deleteAllBulk();
                log.info("[CHECKPOINT] Cleared all checkpoints ({})", deleted);
                return deleted;
            }
            ReentrantLock lock = lockFor(threadId);
            lock.lock();
            try {
                int deleted = repository.deleteByThreadIdBulk(threadId);
                log.info("[CHECKPOINT] Cleared {} checkpoints for thread {}", deleted, threadId);
                return deleted;
            } finally {
                lock.unlock();
            }
        } catch (DataAccessException e) {
            throw new PersistenceException("Checkpoint clear failed: " + e.getMessage(), e);
        }
    }

    public long count(String threadId) {
        requireThread(threadId);
        return repository.countByThreadId(threadId);
    }

    /**
     * Execution counter per node, derived from the node entries of the state's log.
     */
    static Map<String, Integer> channelVersions(WorkflowState state) {
        Map<String, Integer> versions = new TreeMap<>();
        for (Map<String, Object> entry : state.getWorkflowLogs()) {
            Object node = entry.get("node");
            if (node != null) {
                versions.merge(node.toString(), 1, Integer::sum);
            }
        }
        return versions;
    }

    /**
     * @param links newest first
     */
    static Optional<String> headId(List<CheckpointLink> links) {
        if (links.isEmpty()) {
            return Optional.empty();
        }
        Set<String> parents = new HashSet<>();
        for (CheckpointLink link : links) {
            if (link.parentCheckpointId() != null) {
                parents.add(link.parentCheckpointId());
            }
        }
        // a linear chain has exactly one record that is nobody's parent
        return links.stream()
                .map(CheckpointLink::checkpointId)
                .filter(id -> !parents.contains(id))
                .findFirst()
                .or(() -> Optional.of(links.get(0).checkpointId()));
    }

    private List<CheckpointEntity> orderNewestFirst(List<CheckpointEntity> entities) {
        List<CheckpointLink> links = entities.stream()
                .map(e -> new CheckpointLink(e.getCheckpointId(), e.getParentCheckpointId()))
                .toList();
        Optional<String> headId = headId(links);
        if (headId.isEmpty()) {
            return List.of();
        }
        Map<String, CheckpointEntity> byId = new HashMap<>();
        entities.forEach(e -> byId.put(e.getCheckpointId(), e));

        List<CheckpointEntity> ordered = new ArrayList<>(entities.size());
        Set<String> seen = new HashSet<>();
        CheckpointEntity current = byId.get(headId.get());
        while (current != null && seen.add(current.getCheckpointId())) {
            ordered.add(current);
            current = current.getParentCheckpointId() == null ? null : byId.get(current.getParentCheckpointId());
        }
        // rows outside the main chain, if any, keep timestamp order
        for (CheckpointEntity entity : entities) {
            if (seen.add(entity.getCheckpointId())) {
                ordered.add(entity);
            }
        }
        return ordered;
    }

    private ReentrantLock lockFor(String threadId) {
        return threadLocks[Math.floorMod(threadId.hashCode(), LOCK_STRIPES)];
    }

    private CheckpointRecord toRecord(CheckpointEntity entity) {
        return new CheckpointRecord(
                entity.getCheckpointId(),
                entity.getThreadId(),
                entity.getParentCheckpointId(),
                StateSnapshotCodec.decodeState(entity.getStateSnapshot()),
                StateSnapshotCodec.decodeVersions(entity.getChannelVersions()),
                entity.getTimestamp()
        );
    }

    private static void requireThread(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId is required");
        }
    }
}
