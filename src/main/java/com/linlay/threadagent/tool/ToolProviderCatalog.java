package com.linlay.threadagent.tool;

import java.util.List;

public record ToolProviderCatalog(List<ToolProviderSpec> specs) {

    public ToolProviderCatalog {
        specs = specs == null ? List.of() : List.copyOf(specs);
    }
}
