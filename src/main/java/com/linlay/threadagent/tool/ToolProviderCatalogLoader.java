package com.linlay.threadagent.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads tool provider declarations once at startup. Inline {@code agent.tools.providers}
 * entries come first, then the optional JSON catalog in the common
 * {@code {"mcpServers": {...}}} layout. Entries that cannot form a valid
 * {@link ToolProviderSpec} are skipped with a warning, and a duplicated name keeps its
 * first declaration.
 */
public class ToolProviderCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(ToolProviderCatalogLoader.class);
    private static final String SERVERS_FIELD = "mcpServers";

    private final ObjectMapper objectMapper;
    private final ToolProviderProperties properties;

    public ToolProviderCatalogLoader(ObjectMapper objectMapper, ToolProviderProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ToolProviderCatalog load() {
        Map<String, ToolProviderSpec> loaded = new LinkedHashMap<>();
        properties.getProviders().forEach((name, config) -> {
            if (config == null) {
                log.warn("Skip tool provider '{}' without configuration", name);
                return;
            }
            register(loaded, name, config.getCommand(), config.getArgs(), config.getEnv(), "application properties");
        });
        if (StringUtils.hasText(properties.getConfigFile())) {
            loadFile(Path.of(properties.getConfigFile().trim()).toAbsolutePath().normalize(), loaded);
        }
        log.info("Loaded {} tool providers: {}", loaded.size(), loaded.keySet());
        return new ToolProviderCatalog(new ArrayList<>(loaded.values()));
    }

    private void loadFile(Path file, Map<String, ToolProviderSpec> loaded) {
        if (!Files.isRegularFile(file)) {
            log.warn("Tool provider catalog {} does not exist, skip loading", file);
            return;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(file));
        } catch (IOException ex) {
            log.warn("Cannot read tool provider catalog {}", file, ex);
            return;
        }
        JsonNode servers = root == null ? null : root.path(SERVERS_FIELD);
        if (servers == null || !servers.isObject()) {
            log.warn("Tool provider catalog {} has no '{}' object, skip loading", file, SERVERS_FIELD);
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = servers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (!node.isObject()) {
                log.warn("Skip tool provider '{}' in {}: entry is not an object", field.getKey(), file);
                continue;
            }
            List<String> args = readArgs(node.path("args"));
            if (args == null) {
                log.warn("Skip tool provider '{}' in {}: args must be an array", field.getKey(), file);
                continue;
            }
            register(
                    loaded,
                    field.getKey(),
                    node.path("command").isTextual() ? node.path("command").asText() : null,
                    args,
                    readEnv(node.path("env")),
                    file.toString()
            );
        }
    }

    private void register(
            Map<String, ToolProviderSpec> loaded,
            String name,
            String command,
            List<String> args,
            Map<String, String> env,
            String source
    ) {
        ToolProviderSpec spec;
        try {
            spec = new ToolProviderSpec(name, command, args, env);
        } catch (IllegalArgumentException ex) {
            log.warn("Skip invalid tool provider '{}' from {}: {}", name, source, ex.getMessage());
            return;
        }
        if (loaded.containsKey(spec.name())) {
            log.warn("Skip duplicated tool provider '{}' from {}", spec.name(), source);
            return;
        }
        loaded.put(spec.name(), spec);
    }

    private List<String> readArgs(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            return null;
        }
        List<String> args = new ArrayList<>();
        for (JsonNode item : node) {
            args.add(item.isValueNode() && !item.isNull() ? item.asText() : null);
        }
        return args;
    }

    private Map<String, String> readEnv(JsonNode node) {
        Map<String, String> env = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return env;
        }
        node.fields().forEachRemaining(entry ->
                env.put(entry.getKey(), entry.getValue().isNull() ? "" : entry.getValue().asText()));
        return env;
    }
}
