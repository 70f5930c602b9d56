package com.linlay.threadagent.tool;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One provider's connection for the duration of a single turn. State only moves forward:
 * CONNECTING to READY or FAILED, and either of those to CLOSED.
 */
public final class ToolConnection {

    private final String providerName;
    private final AtomicReference<ToolConnectionState> state = new AtomicReference<>(ToolConnectionState.CONNECTING);
    private volatile ToolClient client;
    private volatile List<ToolDescriptor> tools = List.of();
    private volatile Instant establishedAt;

    ToolConnection(String providerName) {
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }

    public ToolConnectionState state() {
        return state.get();
    }

    public Instant establishedAt() {
        return establishedAt;
    }

    public List<ToolDescriptor> tools() {
        return tools;
    }

    public boolean isReady() {
        return state.get() == ToolConnectionState.READY;
    }

    public String callTool(String toolName, String argumentsJson) {
        ToolClient current = client;
        if (!isReady() || current == null) {
            throw new IllegalStateException("Tool provider " + providerName + " is not ready (" + state.get() + ")");
        }
        return current.callTool(toolName, argumentsJson);
    }

    /**
     * @return false when the attempt was already abandoned and the client must be discarded
     */
    boolean attach(ToolClient newClient) {
        this.client = newClient;
        return state.get() == ToolConnectionState.CONNECTING;
    }

    boolean markReady(List<ToolDescriptor> discoveredTools, Instant now) {
        this.tools = discoveredTools == null ? List.of() : List.copyOf(discoveredTools);
        this.establishedAt = now;
        return state.compareAndSet(ToolConnectionState.CONNECTING, ToolConnectionState.READY);
    }

    /**
     * Abandons an attempt that has not reached READY, releasing whatever was started.
     */
    void fail() {
        if (state.compareAndSet(ToolConnectionState.CONNECTING, ToolConnectionState.FAILED)) {
            releaseClient();
        }
    }

    /**
     * @return true when this call performed the close, false when it was already closed or failed
     */
    boolean close() {
        if (!state.compareAndSet(ToolConnectionState.READY, ToolConnectionState.CLOSED)) {
            return false;
        }
        releaseClient();
        return true;
    }

    private void releaseClient() {
        ToolClient current = client;
        client = null;
        if (current != null) {
            current.close();
        }
    }

    @Override
    public String toString() {
        return "ToolConnection[" + providerName + ", " + state.get() + "]";
    }
}
