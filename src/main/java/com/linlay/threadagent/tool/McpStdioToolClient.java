package com.linlay.threadagent.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

class McpStdioToolClient implements ToolClient {

    private static final Logger log = LoggerFactory.getLogger(McpStdioToolClient.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String providerName;
    private final McpSyncClient client;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    McpStdioToolClient(String providerName, McpSyncClient client, ObjectMapper objectMapper) {
        this.providerName = providerName;
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public void initialize() {
        McpSchema.InitializeResult result = client.initialize();
        if (result != null && result.serverInfo() != null) {
            log.debug("[tool:{}] server {} {}", providerName, result.serverInfo().name(), result.serverInfo().version());
        }
    }

    @Override
    public List<ToolDescriptor> listTools() {
        List<ToolDescriptor> tools = new ArrayList<>();
        String cursor = null;
        do {
            McpSchema.ListToolsResult page = cursor == null ? client.listTools() : client.listTools(cursor);
            for (McpSchema.Tool tool : page.tools()) {
                tools.add(new ToolDescriptor(tool.name(), tool.description(), writeSchema(tool)));
            }
            cursor = page.nextCursor();
        } while (cursor != null && !cursor.isBlank());
        return tools;
    }

    @Override
    public String callTool(String toolName, String argumentsJson) {
        Map<String, Object> arguments = readArguments(argumentsJson);
        McpSchema.CallToolResult result = client.callTool(new McpSchema.CallToolRequest(toolName, arguments));
        StringBuilder text = new StringBuilder();
        if (result.content() != null) {
            for (McpSchema.Content content : result.content()) {
                if (content instanceof McpSchema.TextContent textContent) {
                    if (!text.isEmpty()) {
                        text.append('\n');
                    }
                    text.append(textContent.text());
                }
            }
        }
        if (Boolean.TRUE.equals(result.isError())) {
            return "Error: " + text;
        }
        return text.toString();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!client.closeGracefully()) {
                log.debug("[tool:{}] graceful close did not complete", providerName);
            }
        } finally {
            client.close();
        }
    }

    private Map<String, Object> readArguments(String argumentsJson) {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(argumentsJson, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Tool arguments for " + providerName + " are not a JSON object", ex);
        }
    }

    private String writeSchema(McpSchema.Tool tool) {
        if (tool.inputSchema() == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(tool.inputSchema());
        } catch (JsonProcessingException ex) {
            log.debug("[tool:{}] cannot serialize schema of {}: {}", providerName, tool.name(), ex.getMessage());
            return null;
        }
    }
}
