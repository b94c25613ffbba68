package com.vsharp.vgc.io;

import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class TypeMetadataReaderTest {

    @Test
    public void testParseSingleType() throws IOException {
        TypeMetadata meta = TypeMetadataReader.parse("{"
                + "\"name\": \"Counter\","
                + "\"fields\": [ { \"name\": \"count\", \"type\": \"int\" } ],"
                + "\"methods\": [ { \"name\": \"reset\", \"static\": true, \"returnType\": \"void\","
                + "  \"parameters\": [ { \"name\": \"to\", \"type\": \"java.lang.Integer\" } ] } ]"
                + "}");

        assertEquals("Counter", meta.getName());
        assertFalse(meta.isGeneric());
        assertEquals("count", meta.getFields().get(0).getName());
        TypeMetadata.MethodInfo reset = meta.getMethods().get(0);
        assertTrue(reset.isStaticMethod());
        assertFalse(reset.isSpecial());
        assertEquals("java.lang.Integer", reset.getParameters().get(0).getType());
    }

    @Test
    public void testMissingListsDefaultToEmpty() throws IOException {
        TypeMetadata meta = TypeMetadataReader.parse("{\"name\": \"Marker\", \"extra\": 1}");

        assertTrue(meta.getFields().isEmpty());
        assertTrue(meta.getMethods().isEmpty());
    }

    @Test
    public void testParseFile() throws IOException {
        Path file = Files.createTempFile("type", ".json");
        try {
            Files.writeString(file, "{\"name\": \"Pair\", \"generic\": true}");
            assertTrue(TypeMetadataReader.parseFile(file).isGeneric());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test(expected = IOException.class)
    public void testMalformedDocument() throws IOException {
        TypeMetadataReader.parse("{\"name\": ");
    }

    @Test
    public void testFromClassDescribesPublicSurface() {
        TypeMetadata meta = TypeMetadata.fromClass(ReflectionImporterTest.Sample.class);

        assertEquals("Sample", meta.getName());
        assertEquals(2, meta.getFields().size());
        assertTrue(meta.getMethods().stream().noneMatch(m -> m.getName().equals("hashCode")));
        assertTrue(TypeMetadata.fromClass(ReflectionImporterTest.Box.class).isGeneric());
    }
}
