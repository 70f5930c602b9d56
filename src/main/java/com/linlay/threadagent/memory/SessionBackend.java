package com.linlay.threadagent.memory;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL-capable key/value store behind {@link SessionStore}. Implementations may throw any
 * runtime exception when the store is unreachable; the session store absorbs it.
 */
public interface SessionBackend {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);
}
