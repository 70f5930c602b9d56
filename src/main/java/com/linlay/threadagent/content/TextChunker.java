package com.linlay.threadagent.content;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into pieces of at most {@code maxChars} characters. A piece ends after the last
 * whitespace inside its window when there is one, otherwise the window is cut hard, so a word
 * longer than the limit is split across pieces. Concatenating the pieces gives back the input.
 */
public final class TextChunker {

    private TextChunker() {
    }

    public static List<String> split(String text, int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be positive");
        }
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> pieces = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + maxChars, length);
            if (end < length && !Character.isWhitespace(text.charAt(end)) && !Character.isWhitespace(text.charAt(end - 1))) {
                int boundary = lastWhitespace(text, start, end);
                if (boundary > start) {
                    end = boundary + 1;
                }
            }
            pieces.add(text.substring(start, end));
            start = end;
        }
        return pieces;
    }

    public static List<ContentChunk> chunk(String sourceId, String text, int maxChars) {
        List<String> pieces = split(text, maxChars);
        List<ContentChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new ContentChunk(sourceId, i, pieces.get(i)));
        }
        return chunks;
    }

    private static int lastWhitespace(String text, int start, int end) {
        for (int i = end - 1; i > start; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
