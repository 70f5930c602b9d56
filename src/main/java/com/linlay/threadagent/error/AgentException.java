package com.linlay.threadagent.error;

public class AgentException extends RuntimeException {

    private final AgentErrorKind kind;

    public AgentException(AgentErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentException(AgentErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AgentErrorKind kind() {
        return kind;
    }
}
