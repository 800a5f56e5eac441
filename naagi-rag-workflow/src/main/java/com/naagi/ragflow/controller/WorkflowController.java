package com.naagi.ragflow.controller;

import com.naagi.ragflow.dto.AskRequest;
import com.naagi.ragflow.dto.CheckpointSummary;
import com.naagi.ragflow.exception.PersistenceException;
import com.naagi.ragflow.model.WorkflowOutput;
import com.naagi.ragflow.service.QuestionAnsweringService;
import com.naagi.ragflow.service.SessionReset;
import com.naagi.ragflow.workflow.ActivitySink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST surface over {@link QuestionAnsweringService}: ask, checkpoint inspection and session reset.
 */
@RestController
@RequestMapping("/api/qa")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class WorkflowController {

    private static final ActivitySink LOGGING_SINK =
            (message, type, metadata) -> log.debug("[ACTIVITY] {} {}", type, message);

    private final QuestionAnsweringService questionAnsweringService;

    @PostMapping("/ask")
    public ResponseEntity<?> ask(@RequestBody AskRequest request) {
        try {
            request.validate();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        WorkflowOutput output = questionAnsweringService.answerQuestion(
                request.userId(),
                request.sessionId(),
                request.question(),
                request.getCategoriesOrEmpty(),
                request.toConversation(),
                LOGGING_SINK);
        return ResponseEntity.ok(output);
    }

    @GetMapping("/threads/{threadId}/checkpoints")
    public ResponseEntity<?> listCheckpoints(@PathVariable String threadId) {
        try {
            List<CheckpointSummary> summaries = questionAnsweringService.listCheckpoints(threadId).stream()
                    .map(CheckpointSummary::from)
                    .toList();
            return ResponseEntity.ok(summaries);
        } catch (PersistenceException e) {
            return unavailable(e);
        }
    }

    /**
     * Latest checkpoint of the thread.
     */
    @GetMapping("/threads/{threadId}/checkpoints/latest")
    public ResponseEntity<?> getLatestCheckpoint(@PathVariable String threadId) {
        return getCheckpoint(threadId, null);
    }

    @GetMapping("/threads/{threadId}/checkpoints/{checkpointId}")
    public ResponseEntity<?> getCheckpoint(@PathVariable String threadId, @PathVariable String checkpointId) {
        try {
            return questionAnsweringService.getCheckpoint(threadId, checkpointId)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (PersistenceException e) {
            return unavailable(e);
        }
    }

    @PostMapping("/threads/{threadId}/checkpoints/{checkpointId}/resume")
    public ResponseEntity<?> resume(@PathVariable String threadId, @PathVariable String checkpointId) {
        try {
            return questionAnsweringService.resume(checkpointId, threadId, LOGGING_SINK)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (PersistenceException e) {
            return unavailable(e);
        }
    }

    @GetMapping("/threads/{threadId}/checkpoints/{checkpointId}/replay")
    public ResponseEntity<?> replay(@PathVariable String threadId, @PathVariable String checkpointId) {
        try {
            return questionAnsweringService.replay(checkpointId, threadId)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (PersistenceException e) {
            return unavailable(e);
        }
    }

    @DeleteMapping("/threads/{threadId}/checkpoints")
    public ResponseEntity<?> clearThread(@PathVariable String threadId) {
        try {
            int deleted = questionAnsweringService.clearCheckpoints(threadId);
            return ResponseEntity.ok(Map.of("threadId", threadId, "deleted", deleted));
        } catch (PersistenceException e) {
            return unavailable(e);
        }
    }

    @DeleteMapping("/checkpoints")
    public ResponseEntity<?> clearAll() {
        try {
            int deleted = questionAnsweringService.clearCheckpoints(null);
            return ResponseEntity.ok(Map.of("deleted", deleted));
        } catch (PersistenceException e) {
            return unavailable(e);
        }
    }

    @PostMapping("/sessions/{sessionId}/reset")
    public ResponseEntity<SessionReset> resetSession(
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "false") boolean clearCheckpoints) {
        return ResponseEntity.ok(questionAnsweringService.resetSession(sessionId, clearCheckpoints));
    }

    private ResponseEntity<?> unavailable(PersistenceException e) {
        log.warn("[CHECKPOINT] Store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.toLogEntry()));
    }
}
