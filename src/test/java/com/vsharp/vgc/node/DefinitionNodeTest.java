package com.vsharp.vgc.node;

import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.ValueType;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class DefinitionNodeTest {

    @Test
    public void testClassDeclaration() {
        ClassDefinitionNode point = new ClassDefinitionNode("Point")
                .addField("x", ValueType.INT)
                .addField("label", ValueType.STRING)
                .addField("owner", ValueType.OBJECT);

        assertEquals("class Point {\n"
                + "  public int x;\n"
                + "  public String label;\n"
                + "  public Object owner;\n"
                + "}", point.generateDefinitionCode("  "));
        assertEquals("ClassDefinitionNode[Point]", point.label());
    }

    @Test
    public void testEmptyClassDeclaration() {
        assertEquals("class Empty {\n}", new ClassDefinitionNode("Empty").generateDefinitionCode("    "));
    }

    @Test
    public void testDefinitionsHaveNoPorts() {
        ClassDefinitionNode node = new ClassDefinitionNode("T");
        assertTrue(node.inputs().isEmpty());
        assertTrue(node.outputs().isEmpty());
        assertTrue(node.connectedInputs().isEmpty());
    }

    @Test
    public void testMethodSignature() {
        MethodDefinitionNode scale = new MethodDefinitionNode("scale", false, ValueType.FLOAT, "Point",
                List.of(new Slot("factor", ValueType.FLOAT), new Slot("times", ValueType.INT)));
        MethodDefinitionNode origin = new MethodDefinitionNode("origin", true, ValueType.OBJECT, "Point", List.of());

        assertEquals("public float Point.scale(float factor, int times)", scale.signature());
        assertEquals("public static Object Point.origin()", origin.signature());
        assertFalse(scale.isStatic());
        assertEquals("Point", scale.declaringClass());
    }

    @Test
    public void testMethodsKeepDeclarationOrder() {
        MethodDefinitionNode a = new MethodDefinitionNode("a", false, ValueType.VOID, "C", List.of());
        MethodDefinitionNode b = new MethodDefinitionNode("b", false, ValueType.VOID, "C", List.of());
        ClassDefinitionNode c = new ClassDefinitionNode("C").addMethod(a).addMethod(b);

        assertEquals(List.of(a, b), c.methods());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNameRequired() {
        new ClassDefinitionNode("");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testFieldsReadOnly() {
        new ClassDefinitionNode("T").fields().clear();
    }
}
