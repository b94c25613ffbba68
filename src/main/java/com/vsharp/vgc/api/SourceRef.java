package com.vsharp.vgc.api;

/**
 * Identifies the upstream output feeding a connected input: the producer's
 * node id and the name of one of its output slots.
 */
public record SourceRef(String producerId, String outputName) {

    @Override
    public String toString() {
        return producerId + "." + outputName;
    }
}
