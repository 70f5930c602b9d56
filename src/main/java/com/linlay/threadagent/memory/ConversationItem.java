package com.linlay.threadagent.memory;

public record ConversationItem(
        String role,
        String content,
        ItemKind kind,
        long sequenceIndex
) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    public ConversationItem {
        if (role == null || role.isBlank()) {
            role = ROLE_USER;
        }
        if (content == null) {
            content = "";
        }
        if (kind == null) {
            kind = ItemKind.MESSAGE;
        }
    }

    public static ConversationItem user(String content) {
        return new ConversationItem(ROLE_USER, content, ItemKind.MESSAGE, 0);
    }

    public static ConversationItem assistant(String content) {
        return new ConversationItem(ROLE_ASSISTANT, content, ItemKind.MESSAGE, 0);
    }

    public static ConversationItem toolCall(String toolName, String arguments) {
        return new ConversationItem(ROLE_ASSISTANT, toolName + " " + arguments, ItemKind.TOOL_CALL, 0);
    }

    public static ConversationItem toolResult(String toolName, String result) {
        return new ConversationItem(ROLE_TOOL, toolName + ": " + result, ItemKind.TOOL_RESULT, 0);
    }

    public static ConversationItem placeholder(String role) {
        return new ConversationItem(role, "", ItemKind.PLACEHOLDER, 0);
    }

    public ConversationItem withSequenceIndex(long index) {
        return new ConversationItem(role, content, kind, index);
    }

    public boolean modelInput() {
        return kind.modelInput();
    }
}
