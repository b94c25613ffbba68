package com.vsharp.vgc.io;

import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.node.ClassDefinitionNode;
import com.vsharp.vgc.node.MethodDefinitionNode;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DefinitionRegistryTest {

    @Test
    public void testTypedLookup() {
        DefinitionRegistry registry = new DefinitionRegistry();
        ClassDefinitionNode point = new ClassDefinitionNode("Point");
        registry.register(point);

        assertSame(point, registry.get("Point", ClassDefinitionNode.class).orElseThrow());
        assertFalse(registry.get("Point", MethodDefinitionNode.class).isPresent());
        assertFalse(registry.get("Missing", ClassDefinitionNode.class).isPresent());
        assertTrue(registry.contains("Point"));
    }

    @Test
    public void testLaterRegistrationReplaces() {
        DefinitionRegistry registry = new DefinitionRegistry();
        registry.register(new ClassDefinitionNode("Point").addField("x", ValueType.INT));
        ClassDefinitionNode replacement = new ClassDefinitionNode("Point").addField("y", ValueType.FLOAT);
        registry.register(replacement);

        assertEquals(1, registry.size());
        assertSame(replacement, registry.get("Point", ClassDefinitionNode.class).orElseThrow());
    }

    @Test
    public void testIterationOrderIsStable() {
        DefinitionRegistry registry = new DefinitionRegistry();
        for (String name : List.of("C", "A", "B"))
            registry.register(new ClassDefinitionNode(name));
        registry.register(new ClassDefinitionNode("A"));

        assertEquals(List.of("C", "A", "B"), registry.all().stream().map(d -> d.name()).toList());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testAllIsReadOnly() {
        new DefinitionRegistry().all().clear();
    }
}
