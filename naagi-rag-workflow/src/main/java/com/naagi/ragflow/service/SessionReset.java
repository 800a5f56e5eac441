package com.naagi.ragflow.service;

public record SessionReset(String sessionId, int cacheEntriesRemoved, int checkpointsRemoved) {}
