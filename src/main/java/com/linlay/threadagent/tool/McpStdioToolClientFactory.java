package com.linlay.threadagent.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpSchema;

import java.time.Duration;
import java.util.Map;

/**
 * Launches tool providers as child processes speaking MCP over stdio.
 */
public class McpStdioToolClientFactory implements ToolClientFactory {

    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public McpStdioToolClientFactory(ObjectMapper objectMapper, Duration requestTimeout) {
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ToolClient create(ToolProviderSpec spec, Map<String, String> resolvedEnv) {
        ServerParameters params = ServerParameters.builder(spec.command())
                .args(spec.args())
                .env(resolvedEnv)
                .build();
        StdioClientTransport transport = new StdioClientTransport(params);
        McpSyncClient client = McpClient.sync(transport)
                .requestTimeout(requestTimeout)
                .capabilities(McpSchema.ClientCapabilities.builder().build())
                .build();
        return new McpStdioToolClient(spec.name(), client, objectMapper);
    }
}
