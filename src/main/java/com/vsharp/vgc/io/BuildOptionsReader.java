package com.vsharp.vgc.io;

import com.vsharp.vgc.engine.BuildOptions;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads {@link BuildOptions} from JSON. Keys that are missing keep their
 * defaults; unknown keys are ignored.
 */
public final class BuildOptionsReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private BuildOptionsReader() {
        // Utility class
    }

    public static BuildOptions parse(String json) throws IOException {
        return MAPPER.readValue(json, BuildOptions.class);
    }

    public static BuildOptions parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Loads options from a classpath resource.
     *
     * @throws IOException if the resource is missing or malformed.
     */
    public static BuildOptions fromClasspath(String resource) throws IOException {
        try (InputStream in = BuildOptionsReader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return MAPPER.readValue(in, BuildOptions.class);
        }
    }
}
