package com.vsharp.vgc.toolchain;

import com.vsharp.vgc.api.ToolchainFailureException;

import java.util.List;

/**
 * Response of a compile-and-execute request.
 *
 * @param success     True if the unit compiled and the entry point returned.
 * @param diagnostics All diagnostics, in reporting order.
 * @param value       Value returned by the entry point; null on failure.
 */
public record ToolchainResult(boolean success, List<Diagnostic> diagnostics, Object value) {

    public ToolchainResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static ToolchainResult failure(List<Diagnostic> diagnostics) {
        return new ToolchainResult(false, diagnostics, null);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    /**
     * Returns the value, or throws with the error diagnostics if the request
     * failed.
     *
     * @param source The source text that was submitted, kept on the exception.
     */
    public Object requireSuccess(String source) {
        if (!success) {
            List<Diagnostic> errors = errors();
            throw new ToolchainFailureException(errors.isEmpty() ? diagnostics : errors, source);
        }
        return value;
    }
}
