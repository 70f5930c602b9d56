package com.linlay.threadagent.tool;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Fills empty-valued env entries of a provider spec from the runtime environment. A variable
 * that is not set resolves to an empty string.
 */
public class EnvironmentResolver {

    private final Function<String, String> lookup;

    public EnvironmentResolver() {
        this(System::getenv);
    }

    public EnvironmentResolver(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    public Map<String, String> resolve(Map<String, String> env) {
        if (env == null || env.isEmpty()) {
            return Map.of();
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        env.forEach((name, value) -> {
            if (value == null || value.isEmpty()) {
                String runtimeValue = lookup.apply(name);
                resolved.put(name, runtimeValue == null ? "" : runtimeValue);
            } else {
                resolved.put(name, value);
            }
        });
        return resolved;
    }
}
