package com.linlay.threadagent.agent;

/**
 * Stages of one turn, in order. A turn only ever moves forward; DONE and FAILED are terminal.
 */
public enum OrchestratorState {
    IDLE,
    LOADING,
    PREPROCESSING,
    TOOL_BINDING,
    RUNNING,
    PERSISTING,
    DONE,
    FAILED;

    public boolean terminal() {
        return this == DONE || this == FAILED;
    }
}
