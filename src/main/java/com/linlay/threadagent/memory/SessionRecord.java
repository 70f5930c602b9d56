package com.linlay.threadagent.memory;

import java.util.List;

/**
 * Persisted form of one thread's history. Timestamps are epoch millis so the record stays
 * readable by any JSON mapper without extra modules.
 */
public record SessionRecord(
        List<ConversationItem> items,
        long createdAtMillis,
        long expiresAtMillis
) {

    public SessionRecord {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean expiredAt(long nowMillis) {
        return expiresAtMillis > 0 && expiresAtMillis <= nowMillis;
    }

    public long lastSequenceIndex() {
        return items.isEmpty() ? 0 : items.get(items.size() - 1).sequenceIndex();
    }
}
