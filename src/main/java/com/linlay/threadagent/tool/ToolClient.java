package com.linlay.threadagent.tool;

import java.util.List;

/**
 * Blocking handle on one running tool provider.
 */
public interface ToolClient {

    void initialize();

    List<ToolDescriptor> listTools();

    String callTool(String toolName, String argumentsJson);

    void close();
}
