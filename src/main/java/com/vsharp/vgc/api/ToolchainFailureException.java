package com.vsharp.vgc.api;

import com.vsharp.vgc.toolchain.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the external toolchain reports error-severity diagnostics for an
 * emitted unit. The diagnostics and the source text travel with the exception
 * so the caller can report them.
 */
public class ToolchainFailureException extends RuntimeException {
    private final List<Diagnostic> diagnostics;
    private final String source;

    public ToolchainFailureException(List<Diagnostic> diagnostics, String source) {
        super("Toolchain reported " + diagnostics.size() + " error(s): "
                + diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("; ")));
        this.diagnostics = List.copyOf(diagnostics);
        this.source = source;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public String source() {
        return source;
    }
}
