package com.linlay.threadagent.agent;

import com.linlay.threadagent.memory.ThreadKey;

import java.util.Objects;

public record TurnRequest(ThreadKey threadKey, String text) {

    public TurnRequest {
        Objects.requireNonNull(threadKey, "threadKey must not be null");
        text = text == null ? "" : text;
    }
}
