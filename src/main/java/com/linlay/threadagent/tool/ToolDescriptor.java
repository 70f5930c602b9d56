package com.linlay.threadagent.tool;

public record ToolDescriptor(
        String name,
        String description,
        String inputSchema
) {
    public ToolDescriptor {
        if (description == null) {
            description = "";
        }
        if (inputSchema == null || inputSchema.isBlank()) {
            inputSchema = "{\"type\":\"object\",\"properties\":{}}";
        }
    }
}
