package com.naagi.ragflow.model;

/**
 * Identity of a retrieved passage: the source document plus the chunk position inside it.
 */
public record ChunkIdentity(String source, int position) {

    public String key() {
        return source + "#" + position;
    }

    @Override
    public String toString() {
        return key();
    }
}
