package com.linlay.threadagent.agent;

import com.linlay.threadagent.memory.ConversationItem;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;

public record ModelInvocation(
        String systemPrompt,
        List<ConversationItem> history,
        String userText,
        List<ToolCallback> toolCallbacks
) {

    public ModelInvocation {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        history = history == null ? List.of() : List.copyOf(history);
        userText = userText == null ? "" : userText;
        toolCallbacks = toolCallbacks == null ? List.of() : List.copyOf(toolCallbacks);
    }
}
