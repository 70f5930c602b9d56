package com.linlay.threadagent.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.threadagent.error.AgentErrorKind;
import com.linlay.threadagent.error.SessionBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, TTL-refreshed conversation history per reply thread.
 * <p>
 * Every operation is fail-open: an unreachable or corrupt backend reads as "no history" and a
 * failed write is logged and skipped. Callers never see backend exceptions.
 * <p>
 * The read-modify-write inside {@link #appendAndSave} is serialized per key within this
 * process, so two turns landing on the same thread both end up in the record. Writers in other
 * processes still race with last-writer-wins.
 */
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
    private static final int LOCK_STRIPES = 64;

    private final SessionBackend backend;
    private final ObjectMapper objectMapper;
    private final SessionStoreProperties properties;
    private final Clock clock;
    private final Object[] keyLocks = new Object[LOCK_STRIPES];

    public SessionStore(SessionBackend backend, ObjectMapper objectMapper, SessionStoreProperties properties) {
        this(backend, objectMapper, properties, Clock.systemUTC());
    }

    public SessionStore(SessionBackend backend, ObjectMapper objectMapper, SessionStoreProperties properties, Clock clock) {
        if (properties.getMaxItems() < 1) {
            throw new IllegalArgumentException("agent.session.max-items must be at least 1");
        }
        this.backend = backend;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new Object();
        }
    }

    public List<ConversationItem> load(ThreadKey key) {
        String cacheKey = cacheKey(key);
        return readRecord(cacheKey)
                .map(record -> SessionHistoryPolicy.filter(record.items()))
                .orElse(List.of());
    }

    public List<ConversationItem> loadRecent(ThreadKey key, int limit) {
        List<ConversationItem> items = load(key);
        if (limit < 0 || items.size() <= limit) {
            return items;
        }
        return List.copyOf(items.subList(items.size() - limit, items.size()));
    }

    public void appendAndSave(ThreadKey key, List<ConversationItem> newItems, Duration ttl) {
        String cacheKey = cacheKey(key);
        synchronized (lockFor(cacheKey)) {
            Optional<SessionRecord> existing = readRecord(cacheKey);
            List<ConversationItem> merged = new ArrayList<>();
            long nextIndex = 1;
            long createdAt = clock.millis();
            if (existing.isPresent()) {
                merged.addAll(existing.get().items());
                nextIndex = existing.get().lastSequenceIndex() + 1;
                createdAt = existing.get().createdAtMillis();
            }
            if (newItems != null) {
                for (ConversationItem item : newItems) {
                    if (item != null) {
                        merged.add(item.withSequenceIndex(nextIndex++));
                    }
                }
            }
            writeRecord(cacheKey, merged, createdAt, ttl);
        }
    }

    public void appendAndSave(ThreadKey key, List<ConversationItem> newItems) {
        appendAndSave(key, newItems, properties.getTtl());
    }

    public void replace(ThreadKey key, List<ConversationItem> items, Duration ttl) {
        String cacheKey = cacheKey(key);
        synchronized (lockFor(cacheKey)) {
            List<ConversationItem> renumbered = new ArrayList<>();
            long index = 1;
            for (ConversationItem item : items == null ? List.<ConversationItem>of() : items) {
                if (item != null) {
                    renumbered.add(item.withSequenceIndex(index++));
                }
            }
            writeRecord(cacheKey, renumbered, clock.millis(), ttl);
        }
    }

    public Optional<ConversationItem> popLast(ThreadKey key) {
        String cacheKey = cacheKey(key);
        synchronized (lockFor(cacheKey)) {
            Optional<SessionRecord> existing = readRecord(cacheKey);
            if (existing.isEmpty() || existing.get().items().isEmpty()) {
                return Optional.empty();
            }
            List<ConversationItem> items = new ArrayList<>(existing.get().items());
            ConversationItem last = items.remove(items.size() - 1);
            writeRecord(cacheKey, items, existing.get().createdAtMillis(), properties.getTtl());
            return Optional.of(last);
        }
    }

    public void clear(ThreadKey key) {
        String cacheKey = cacheKey(key);
        try {
            backend.delete(cacheKey);
            log.debug("[session:{}] cleared", cacheKey);
        } catch (RuntimeException ex) {
            logFailure(SessionBackendException.writeFailed(cacheKey, ex));
        }
    }

    public int maxItems() {
        return properties.getMaxItems();
    }

    public Duration ttl() {
        return properties.getTtl();
    }

    String cacheKey(ThreadKey key) {
        return key.cacheKey(properties.getKeyPrefix());
    }

    private Optional<SessionRecord> readRecord(String cacheKey) {
        Optional<String> raw;
        try {
            raw = backend.get(cacheKey);
        } catch (RuntimeException ex) {
            logFailure(SessionBackendException.unavailable(cacheKey, ex));
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            log.debug("[session:{}] no prior history", cacheKey);
            return Optional.empty();
        }
        SessionRecord record;
        try {
            record = objectMapper.readValue(raw.get(), SessionRecord.class);
        } catch (JsonProcessingException ex) {
            logFailure(SessionBackendException.unavailable(cacheKey, ex));
            return Optional.empty();
        }
        if (record.expiredAt(clock.millis())) {
            log.debug("[session:{}] record expired", cacheKey);
            return Optional.empty();
        }
        log.debug("[session:{}] loaded {} items", cacheKey, record.items().size());
        return Optional.of(record);
    }

    private void writeRecord(String cacheKey, List<ConversationItem> items, long createdAt, Duration ttl) {
        Duration effectiveTtl = ttl == null || ttl.isNegative() || ttl.isZero() ? properties.getTtl() : ttl;
        List<ConversationItem> bounded = SessionHistoryPolicy.apply(items, properties.getMaxItems());
        long now = clock.millis();
        SessionRecord record = new SessionRecord(bounded, createdAt, now + effectiveTtl.toMillis());
        try {
            String json = objectMapper.writeValueAsString(record);
            backend.set(cacheKey, json, effectiveTtl);
            log.debug("[session:{}] saved {} items with ttl {}", cacheKey, bounded.size(), effectiveTtl);
        } catch (JsonProcessingException | RuntimeException ex) {
            logFailure(SessionBackendException.writeFailed(cacheKey, ex));
        }
    }

    private Object lockFor(String cacheKey) {
        return keyLocks[Math.floorMod(cacheKey.hashCode(), LOCK_STRIPES)];
    }

    private void logFailure(SessionBackendException ex) {
        Throwable cause = ex.getCause();
        String reason = cause == null ? ex.getMessage() : cause.getMessage();
        if (ex.kind() == AgentErrorKind.CACHE_UNAVAILABLE) {
            log.warn("[{}] {}, continuing without history: {}", ex.kind(), ex.getMessage(), reason);
        } else {
            log.warn("[{}] {}, write skipped: {}", ex.kind(), ex.getMessage(), reason);
        }
    }
}
