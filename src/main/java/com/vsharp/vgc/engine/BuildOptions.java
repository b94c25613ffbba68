package com.vsharp.vgc.engine;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Settings of the code builder. Every field has a default, so an empty JSON
 * object yields a usable configuration.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BuildOptions {
    private String className = "GeneratedProgram";
    private String methodName = "execute";
    private String indent = "    ";
    private List<String> defaultImports = new ArrayList<>(List.of("java.util.*"));
    private DefinitionNodePolicy definitionNodePolicy = DefinitionNodePolicy.SKIP;

    /** What the builder does with a definition node found in the runtime node list. */
    public enum DefinitionNodePolicy {
        /** Schedule it, emit nothing for it. */
        SKIP,
        /** Fail the build with {@link UnsupportedOperationException}. */
        REJECT
    }

    public static BuildOptions defaults() {
        return new BuildOptions();
    }
}
