package com.linlay.threadagent.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "agent.model")
public class ModelProperties {

    private String systemPrompt = "You are a helpful assistant. Answer in the language the user writes in.";
    private String replyTitle;
    private int maxAttempts = 3;
    private Duration retryBackoff = Duration.ofSeconds(1);
    private int historyLimit = 0;
    private String failureMessage = "Sorry, the model could not answer right now. Please try again later.";

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getReplyTitle() {
        return replyTitle;
    }

    public void setReplyTitle(String replyTitle) {
        this.replyTitle = replyTitle;
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
        this.retryBackoff = retryBackoff == null ? Duration.ofSeconds(1) : retryBackoff;
    }

    /**
     * Most recent history items sent to the model; 0 sends everything the session holds.
     */
    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public void setFailureMessage(String failureMessage) {
        this.failureMessage = failureMessage;
    }
}
