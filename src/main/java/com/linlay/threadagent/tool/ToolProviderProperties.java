package com.linlay.threadagent.tool;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/* Providers can be declared inline or in a JSON catalog file
```yaml
agent:
  tools:
    connect-timeout: 30s
    cleanup-timeout: 10s
    config-file: ./mcp-servers.json
    providers:
      firecrawl-mcp:
        command: npx
        args: [ "-y", "firecrawl-mcp" ]
        env:
          FIRECRAWL_API_KEY: ""
```
*/

@ConfigurationProperties(prefix = "agent.tools")
public class ToolProviderProperties {

    private Duration connectTimeout = Duration.ofSeconds(30);
    private Duration cleanupTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(300);
    private String configFile;
    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getCleanupTimeout() {
        return cleanupTimeout;
    }

    public void setCleanupTimeout(Duration cleanupTimeout) {
        this.cleanupTimeout = cleanupTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public static class ProviderConfig {
        private String command;
        private List<String> args = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public List<String> getArgs() {
            return args;
        }

        public void setArgs(List<String> args) {
            this.args = args;
        }

        public Map<String, String> getEnv() {
            return env;
        }

        public void setEnv(Map<String, String> env) {
            this.env = env;
        }
    }
}
