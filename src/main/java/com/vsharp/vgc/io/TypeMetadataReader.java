package com.vsharp.vgc.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads external type metadata documents.
 *
 * A document is either a single type object or an array of them:
 *
 * <pre>
 * {
 *   "name": "Point",
 *   "fields": [ { "name": "x", "type": "int" }, { "name": "y", "type": "float" } ],
 *   "methods": [ { "name": "scale", "static": false, "returnType": "void",
 *                  "parameters": [ { "name": "factor", "type": "int" } ] } ]
 * }
 * </pre>
 */
public final class TypeMetadataReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TypeMetadataReader() {
        // Utility class
    }

    public static TypeMetadata parse(String json) throws IOException {
        return MAPPER.readValue(json, TypeMetadata.class);
    }

    public static TypeMetadata parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Reads a JSON array of type documents. */
    public static List<TypeMetadata> parseAll(InputStream in) throws IOException {
        return MAPPER.readValue(in, new TypeReference<List<TypeMetadata>>() {
        });
    }
}
