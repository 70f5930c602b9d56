package com.linlay.threadagent.memory;

/**
 * Reply thread a conversation is scoped to: the bot message being replied to plus its chat.
 */
public record ThreadKey(long anchorMessageId, long chatId) {

    public static final String DEFAULT_PREFIX = "bot";

    public static ThreadKey of(long anchorMessageId, long chatId) {
        return new ThreadKey(anchorMessageId, chatId);
    }

    public String cacheKey() {
        return cacheKey(DEFAULT_PREFIX);
    }

    public String cacheKey(String prefix) {
        String normalizedPrefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
        return normalizedPrefix + ":" + anchorMessageId + ":" + chatId;
    }

    @Override
    public String toString() {
        return cacheKey();
    }
}
