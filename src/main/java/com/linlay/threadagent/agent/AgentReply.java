package com.linlay.threadagent.agent;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a turn hands back to the presentation layer. {@code title} is optional; delivery and
 * pagination are up to the caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentReply(String content, String title) {

    public AgentReply {
        content = content == null ? "" : content;
        title = title == null || title.isBlank() ? null : title.trim();
    }

    public static AgentReply of(String content) {
        return new AgentReply(content, null);
    }
}
