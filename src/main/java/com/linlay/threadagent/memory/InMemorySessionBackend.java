package com.linlay.threadagent.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local backend. Entries past their TTL are dropped on read, and writes sweep every
 * expired entry at most once per {@link #SWEEP_INTERVAL} so threads that are never read again
 * do not pile up.
 */
public class InMemorySessionBackend implements SessionBackend {

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong nextSweepAtMillis = new AtomicLong();
    private final Clock clock;

    public InMemorySessionBackend() {
        this(Clock.systemUTC());
    }

    public InMemorySessionBackend(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMillis() <= clock.millis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        long now = clock.millis();
        sweepExpired(now);
        entries.put(key, new Entry(value, now + ttl.toMillis()));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    private void sweepExpired(long now) {
        long due = nextSweepAtMillis.get();
        if (now < due || !nextSweepAtMillis.compareAndSet(due, now + SWEEP_INTERVAL.toMillis())) {
            return;
        }
        entries.values().removeIf(entry -> entry.expiresAtMillis() <= now);
    }

    int size() {
        return entries.size();
    }

    private record Entry(String value, long expiresAtMillis) {
    }
}
