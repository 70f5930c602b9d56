package com.linlay.threadagent.memory;

public enum ItemKind {

    MESSAGE(true),
    TOOL_CALL(false),
    TOOL_RESULT(false),
    PLACEHOLDER(false);

    private final boolean modelInput;

    ItemKind(boolean modelInput) {
        this.modelInput = modelInput;
    }

    public boolean modelInput() {
        return modelInput;
    }
}
