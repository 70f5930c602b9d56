package com.linlay.threadagent.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "agent.session")
public class SessionStoreProperties {

    private String keyPrefix = ThreadKey.DEFAULT_PREFIX;
    private Duration ttl = Duration.ofDays(7);
    private int maxItems = 50;
    private BackendType backend = BackendType.REDIS;

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl == null ? Duration.ofDays(7) : ttl;
    }

    public int getMaxItems() {
        return maxItems;
    }

    public void setMaxItems(int maxItems) {
        this.maxItems = maxItems;
    }

    public BackendType getBackend() {
        return backend;
    }

    public void setBackend(BackendType backend) {
        this.backend = backend == null ? BackendType.REDIS : backend;
    }

    public enum BackendType {
        REDIS,
        MEMORY
    }
}
