package com.vsharp.vgc.toolchain;

/**
 * The external compiler and runtime that turns emitted source into a result.
 *
 * A single blocking call: the source text goes in, a success flag, the
 * diagnostics and the returned value come out. Timeouts and cancellation are
 * the implementation's concern.
 */
@FunctionalInterface
public interface Toolchain {

    ToolchainResult compileAndExecute(String source);
}
