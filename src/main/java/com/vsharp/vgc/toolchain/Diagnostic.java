package com.vsharp.vgc.toolchain;

/**
 * One message reported by the toolchain.
 *
 * @param severity Only {@link Severity#ERROR} blocks a build.
 * @param message  Human-readable text.
 * @param line     1-based line in the emitted source, or -1 if not tied to a line.
 */
public record Diagnostic(Severity severity, String message, long line) {

    /** Diagnostic severity levels. */
    public enum Severity {
        ERROR, WARNING, INFO
    }

    public static Diagnostic error(String message) {
        return new Diagnostic(Severity.ERROR, message, -1);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return line > 0 ? severity + " line " + line + ": " + message : severity + ": " + message;
    }
}
