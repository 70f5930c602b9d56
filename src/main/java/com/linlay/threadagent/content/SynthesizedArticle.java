package com.linlay.threadagent.content;

public record SynthesizedArticle(String text, int sourceChunks, boolean truncated) {

    public SynthesizedArticle {
        text = text == null ? "" : text;
    }

    /**
     * Cuts {@code text} down to {@code maxChars} when the synthesizer overshot its bound.
     */
    public static SynthesizedArticle bounded(String text, int sourceChunks, int maxChars) {
        String value = text == null ? "" : text;
        if (value.length() <= maxChars) {
            return new SynthesizedArticle(value, sourceChunks, false);
        }
        return new SynthesizedArticle(value.substring(0, maxChars), sourceChunks, true);
    }
}
