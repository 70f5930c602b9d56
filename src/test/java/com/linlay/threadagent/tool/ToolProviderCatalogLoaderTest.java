package com.linlay.threadagent.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolProviderCatalogLoaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldMergeInlineProvidersWithJsonCatalog(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("mcp-servers.json");
        Files.writeString(file, """
                {
                  "mcpServers": {
                    "yfinance": {
                      "command": "uvx",
                      "args": ["yfmcp@latest"]
                    },
                    "firecrawl-mcp": {
                      "command": "npx",
                      "args": ["-y", "firecrawl-mcp"],
                      "env": {"FIRECRAWL_API_KEY": ""}
                    }
                  }
                }
                """);
        ToolProviderProperties properties = new ToolProviderProperties();
        properties.setConfigFile(file.toString());
        ToolProviderProperties.ProviderConfig inline = new ToolProviderProperties.ProviderConfig();
        inline.setCommand("uvx");
        inline.setArgs(List.of("mcp-server-fetch"));
        properties.setProviders(new java.util.LinkedHashMap<>(Map.of("fetch", inline)));

        ToolProviderCatalog catalog = new ToolProviderCatalogLoader(objectMapper, properties).load();

        assertThat(catalog.specs()).extracting(ToolProviderSpec::name)
                .containsExactly("fetch", "yfinance", "firecrawl-mcp");
        ToolProviderSpec firecrawl = catalog.specs().get(2);
        assertThat(firecrawl.command()).isEqualTo("npx");
        assertThat(firecrawl.args()).containsExactly("-y", "firecrawl-mcp");
        assertThat(firecrawl.env()).containsEntry("FIRECRAWL_API_KEY", "");
    }

    @Test
    void shouldSkipMalformedAndDuplicatedEntries(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("servers.json");
        Files.writeString(file, """
                {
                  "mcpServers": {
                    "no-command": {"args": ["x"]},
                    "bad-args": {"command": "run", "args": "not-a-list"},
                    "not-an-object": "uvx tool",
                    "fetch": {"command": "other"},
                    "ok": {"command": "ok-server"}
                  }
                }
                """);
        ToolProviderProperties properties = new ToolProviderProperties();
        properties.setConfigFile(file.toString());
        ToolProviderProperties.ProviderConfig inline = new ToolProviderProperties.ProviderConfig();
        inline.setCommand("uvx");
        properties.setProviders(new java.util.LinkedHashMap<>(Map.of("fetch", inline)));

        ToolProviderCatalog catalog = new ToolProviderCatalogLoader(objectMapper, properties).load();

        assertThat(catalog.specs()).extracting(ToolProviderSpec::name).containsExactly("fetch", "ok");
        assertThat(catalog.specs().get(0).command()).isEqualTo("uvx");
    }

    @Test
    void shouldReturnEmptyCatalogWhenFileIsMissingOrInvalid(@TempDir Path tempDir) throws IOException {
        ToolProviderProperties missing = new ToolProviderProperties();
        missing.setConfigFile(tempDir.resolve("absent.json").toString());
        assertThat(new ToolProviderCatalogLoader(objectMapper, missing).load().specs()).isEmpty();

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        ToolProviderProperties invalid = new ToolProviderProperties();
        invalid.setConfigFile(broken.toString());
        assertThat(new ToolProviderCatalogLoader(objectMapper, invalid).load().specs()).isEmpty();
    }
}
