package com.linlay.threadagent.tool;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Exposes one tool of a ready provider connection to the model.
 */
public class McpToolCallback implements ToolCallback {

    private final ToolConnection connection;
    private final ToolDescriptor tool;
    private final ToolDefinition definition;

    public McpToolCallback(ToolConnection connection, ToolDescriptor tool) {
        this.connection = connection;
        this.tool = tool;
        this.definition = ToolDefinition.builder()
                .name(tool.name())
                .description(tool.description().isBlank() ? tool.name() + " (" + connection.providerName() + ")" : tool.description())
                .inputSchema(tool.inputSchema())
                .build();
    }

    /**
     * Collects the callbacks of every ready connection. When two providers publish the same
     * tool name the first connection wins.
     */
    public static List<ToolCallback> fromConnections(List<ToolConnection> connections) {
        List<ToolCallback> callbacks = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        for (ToolConnection connection : connections) {
            if (!connection.isReady()) {
                continue;
            }
            for (ToolDescriptor descriptor : connection.tools()) {
                if (names.add(descriptor.name())) {
                    callbacks.add(new McpToolCallback(connection, descriptor));
                }
            }
        }
        return callbacks;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        return connection.callTool(tool.name(), toolInput);
    }

    public String providerName() {
        return connection.providerName();
    }
}
