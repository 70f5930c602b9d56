package com.linlay.threadagent.error;

/**
 * Failure categories of a turn. Only {@link #MODEL_INVOCATION_FAILED} reaches the end user,
 * every other kind degrades the turn and is logged.
 */
public enum AgentErrorKind {

    CACHE_UNAVAILABLE,
    TOOL_CONNECT_FAILED,
    TOOL_CONNECT_TIMEOUT,
    PREPROCESSING_FAILED,
    MODEL_INVOCATION_FAILED,
    PERSISTENCE_FAILED
}
