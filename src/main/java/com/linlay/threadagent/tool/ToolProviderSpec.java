package com.linlay.threadagent.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Launch description of one stdio tool provider. An empty env value is resolved from the
 * process environment under the same name when the provider is started.
 */
public record ToolProviderSpec(
        String name,
        String command,
        List<String> args,
        Map<String, String> env
) {

    public ToolProviderSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool provider name must not be blank");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Tool provider '" + name + "' has no command");
        }
        name = name.trim();
        command = command.trim();
        if (args == null) {
            args = List.of();
        } else {
            for (String arg : args) {
                if (arg == null) {
                    throw new IllegalArgumentException("Tool provider '" + name + "' has a null argument");
                }
            }
            args = List.copyOf(args);
        }
        if (env == null) {
            env = Map.of();
        } else {
            Map<String, String> copy = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : env.entrySet()) {
                String key = entry.getKey();
                if (key == null || key.isBlank()) {
                    throw new IllegalArgumentException("Tool provider '" + name + "' has a blank env name");
                }
                copy.put(key.trim(), entry.getValue() == null ? "" : entry.getValue());
            }
            env = Collections.unmodifiableMap(copy);
        }
    }

    public static ToolProviderSpec of(String name, String command, List<String> args) {
        return new ToolProviderSpec(name, command, args, Map.of());
    }
}
