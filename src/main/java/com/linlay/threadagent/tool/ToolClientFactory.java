package com.linlay.threadagent.tool;

import java.util.Map;

@FunctionalInterface
public interface ToolClientFactory {

    /**
     * Builds a client for the provider without starting the handshake.
     *
     * @param resolvedEnv env with runtime substitutions already applied
     */
    ToolClient create(ToolProviderSpec spec, Map<String, String> resolvedEnv);
}
