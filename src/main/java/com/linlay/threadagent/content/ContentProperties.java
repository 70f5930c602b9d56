package com.linlay.threadagent.content;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "agent.content")
public class ContentProperties {

    private int singleChunkThreshold = 10_000;
    private int maxSynthesisChars = 2_000;
    private Duration condenseTimeout = Duration.ofSeconds(120);
    private FetchProperties fetch = new FetchProperties();

    public int getSingleChunkThreshold() {
        return singleChunkThreshold;
    }

    public void setSingleChunkThreshold(int singleChunkThreshold) {
        this.singleChunkThreshold = singleChunkThreshold;
    }

    public int getMaxSynthesisChars() {
        return maxSynthesisChars;
    }

    public void setMaxSynthesisChars(int maxSynthesisChars) {
        this.maxSynthesisChars = maxSynthesisChars;
    }

    public Duration getCondenseTimeout() {
        return condenseTimeout;
    }

    public void setCondenseTimeout(Duration condenseTimeout) {
        this.condenseTimeout = condenseTimeout == null ? Duration.ofSeconds(120) : condenseTimeout;
    }

    public FetchProperties getFetch() {
        return fetch;
    }

    public void setFetch(FetchProperties fetch) {
        this.fetch = fetch == null ? new FetchProperties() : fetch;
    }

    public static class FetchProperties {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxChars = 200_000;
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(500);
        private String userAgent = "thread-agent/0.1";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        }

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff == null ? Duration.ofMillis(500) : retryBackoff;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }
}
