package com.linlay.threadagent.memory;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter and trim rules applied to a thread history before it is written. Filtering always
 * runs first so the trim window counts only items usable as model input.
 */
public final class SessionHistoryPolicy {

    private SessionHistoryPolicy() {
    }

    public static List<ConversationItem> filter(List<ConversationItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<ConversationItem> kept = new ArrayList<>(items.size());
        for (ConversationItem item : items) {
            if (item != null && item.modelInput()) {
                kept.add(item);
            }
        }
        return kept;
    }

    public static List<ConversationItem> trim(List<ConversationItem> items, int maxItems) {
        if (items.size() <= maxItems) {
            return items;
        }
        return new ArrayList<>(items.subList(items.size() - maxItems, items.size()));
    }

    public static List<ConversationItem> apply(List<ConversationItem> items, int maxItems) {
        return trim(filter(items), maxItems);
    }
}
