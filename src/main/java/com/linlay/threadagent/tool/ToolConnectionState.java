package com.linlay.threadagent.tool;

public enum ToolConnectionState {
    CONNECTING,
    READY,
    FAILED,
    CLOSED
}
