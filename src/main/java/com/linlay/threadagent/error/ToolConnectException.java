package com.linlay.threadagent.error;

import java.time.Duration;

public class ToolConnectException extends AgentException {

    private final String providerName;

    private ToolConnectException(AgentErrorKind kind, String providerName, String message, Throwable cause) {
        super(kind, message, cause);
        this.providerName = providerName;
    }

    public static ToolConnectException timeout(String providerName, Duration timeout) {
        return new ToolConnectException(
                AgentErrorKind.TOOL_CONNECT_TIMEOUT,
                providerName,
                "Connection to tool provider " + providerName + " timed out after " + timeout.toMillis() + "ms",
                null
        );
    }

    public static ToolConnectException failed(String providerName, Throwable cause) {
        String reason = cause == null || cause.getMessage() == null ? "unknown error" : cause.getMessage();
        return new ToolConnectException(
                AgentErrorKind.TOOL_CONNECT_FAILED,
                providerName,
                "Cannot connect to tool provider " + providerName + ": " + reason,
                cause
        );
    }

    public String providerName() {
        return providerName;
    }
}
