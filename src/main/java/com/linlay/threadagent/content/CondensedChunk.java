package com.linlay.threadagent.content;

/**
 * Condensed form of exactly one {@link ContentChunk}. {@code fallback} marks chunks whose
 * condensation failed and which carry a truncated copy of the raw text instead.
 */
public record CondensedChunk(int ordinal, String condensedText, boolean fallback) {

    public CondensedChunk {
        condensedText = condensedText == null ? "" : condensedText;
    }

    public static CondensedChunk condensed(int ordinal, String text) {
        return new CondensedChunk(ordinal, text, false);
    }

    public static CondensedChunk fallback(ContentChunk chunk, int maxChars) {
        String raw = chunk.rawText();
        return new CondensedChunk(chunk.ordinal(), raw.length() <= maxChars ? raw : raw.substring(0, maxChars), true);
    }
}
