package com.linlay.threadagent.error;

public class ModelInvocationException extends AgentException {

    private final boolean transientFailure;
    private final int attempts;

    public ModelInvocationException(String message, Throwable cause, boolean transientFailure, int attempts) {
        super(AgentErrorKind.MODEL_INVOCATION_FAILED, message, cause);
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public boolean transientFailure() {
        return transientFailure;
    }

    public int attempts() {
        return attempts;
    }
}
