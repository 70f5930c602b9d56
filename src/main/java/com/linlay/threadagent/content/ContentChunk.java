package com.linlay.threadagent.content;

/**
 * One slice of a source document. {@code ordinal} starts at 0 and defines reassembly order.
 */
public record ContentChunk(String sourceId, int ordinal, String rawText) {

    public ContentChunk {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must not be negative");
        }
        rawText = rawText == null ? "" : rawText;
    }

    public int length() {
        return rawText.length();
    }
}
