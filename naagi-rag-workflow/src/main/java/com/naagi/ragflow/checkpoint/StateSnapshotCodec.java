package com.naagi.ragflow.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.naagi.ragflow.exception.PersistenceException;
import com.naagi.ragflow.json.Json;
import com.naagi.ragflow.model.WorkflowState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON form of {@link WorkflowState} and channel versions for the checkpoint table.
 */
final class StateSnapshotCodec {

    private static final TypeReference<LinkedHashMap<String, Integer>> VERSIONS = new TypeReference<>() {};

    private StateSnapshotCodec() {}

    static String encodeState(WorkflowState state) {
        try {
            return Json.MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize workflow state: " + e.getOriginalMessage(), e);
        }
    }

    static WorkflowState decodeState(String json) {
        try {
            return Json.MAPPER.readValue(json, WorkflowState.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt state snapshot: " + e.getOriginalMessage(), e);
        }
    }

    static String encodeVersions(Map<String, Integer> versions) {
        try {
            return Json.MAPPER.writeValueAsString(versions);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize channel versions: " + e.getOriginalMessage(), e);
        }
    }

    static Map<String, Integer> decodeVersions(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Json.MAPPER.readValue(json, VERSIONS);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt channel versions: " + e.getOriginalMessage(), e);
        }
    }
}
