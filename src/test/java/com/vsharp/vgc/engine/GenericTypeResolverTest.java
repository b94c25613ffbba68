package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.TypeMismatchException;
import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.node.BinaryOpNode;
import com.vsharp.vgc.node.BinaryOperator;
import com.vsharp.vgc.node.LiteralNode;
import com.vsharp.vgc.node.ReturnNode;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class GenericTypeResolverTest {

    @Test
    public void testConcreteOutputResolvesWholeGroup() {
        LiteralNode a = new LiteralNode(ValueType.FLOAT, 1.5f);
        BinaryOpNode mul = BinaryOpNode.generic(BinaryOperator.MULTIPLY);

        GenericTypeResolver.unify(a, LiteralNode.OUTPUT, mul, BinaryOpNode.LEFT);

        for (Slot s : mul.inputs())
            assertEquals(ValueType.FLOAT, s.type());
        assertEquals(ValueType.FLOAT, mul.output(BinaryOpNode.OUTPUT).orElseThrow().type());
        assertEquals(BinaryOpNode.GROUP, mul.output(BinaryOpNode.OUTPUT).orElseThrow().genericGroup());

        NodeConnector.connect(a, LiteralNode.OUTPUT, mul, BinaryOpNode.LEFT);
        assertEquals(1, mul.connectedInputs().size());
    }

    @Test
    public void testConcreteInputResolvesGenericProducer() {
        BinaryOpNode add = BinaryOpNode.generic(BinaryOperator.ADD);
        ReturnNode ret = new ReturnNode(ValueType.STRING);

        GenericTypeResolver.unify(add, BinaryOpNode.OUTPUT, ret, ReturnNode.INPUT);

        assertEquals(ValueType.STRING, add.input(BinaryOpNode.LEFT).orElseThrow().type());
    }

    @Test
    public void testConflictingResolutionFails() {
        LiteralNode i = new LiteralNode(ValueType.INT, 1);
        LiteralNode f = new LiteralNode(ValueType.FLOAT, 1f);
        BinaryOpNode add = BinaryOpNode.generic(BinaryOperator.ADD);
        GenericTypeResolver.unify(i, LiteralNode.OUTPUT, add, BinaryOpNode.LEFT);
        NodeConnector.connect(i, LiteralNode.OUTPUT, add, BinaryOpNode.LEFT);

        // group already INT: no rebinding, connector rejects
        GenericTypeResolver.unify(f, LiteralNode.OUTPUT, add, BinaryOpNode.RIGHT);
        try {
            NodeConnector.connect(f, LiteralNode.OUTPUT, add, BinaryOpNode.RIGHT);
            fail("Expected TypeMismatchException");
        } catch (TypeMismatchException expected) {
            assertEquals(ValueType.INT, add.input(BinaryOpNode.RIGHT).orElseThrow().type());
        }
    }

    @Test(expected = TypeMismatchException.class)
    public void testBindGroupRejectsSecondType() {
        BinaryOpNode add = BinaryOpNode.generic(BinaryOperator.ADD);
        GenericTypeResolver.bindGroup(add, BinaryOpNode.GROUP, ValueType.INT);
        GenericTypeResolver.bindGroup(add, BinaryOpNode.GROUP, ValueType.STRING);
    }

    @Test
    public void testBindGroupSameTypeTwiceIsAllowed() {
        BinaryOpNode add = BinaryOpNode.generic(BinaryOperator.ADD);
        GenericTypeResolver.resolve(add, Map.of(BinaryOpNode.GROUP, ValueType.INT));
        GenericTypeResolver.resolve(add, Map.of(BinaryOpNode.GROUP, ValueType.INT));
        assertEquals(ValueType.INT, add.output(BinaryOpNode.OUTPUT).orElseThrow().type());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownGroup() {
        GenericTypeResolver.bindGroup(BinaryOpNode.generic(BinaryOperator.ADD), "U", ValueType.INT);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPlaceholderIsNotAResolution() {
        GenericTypeResolver.bindGroup(BinaryOpNode.generic(BinaryOperator.ADD), BinaryOpNode.GROUP,
                ValueType.GENERIC_PLACEHOLDER);
    }

    @Test
    public void testConcretePortsAreLeftAlone() {
        LiteralNode a = new LiteralNode(ValueType.INT, 1);
        ReturnNode ret = new ReturnNode(ValueType.STRING);

        GenericTypeResolver.unify(a, LiteralNode.OUTPUT, ret, ReturnNode.INPUT);

        assertEquals(ValueType.STRING, ret.input(ReturnNode.INPUT).orElseThrow().type());
    }

    @Test
    public void testGenericToGenericStaysUnresolved() {
        BinaryOpNode add = BinaryOpNode.generic(BinaryOperator.ADD);
        ReturnNode ret = ReturnNode.generic();

        GenericTypeResolver.unify(add, BinaryOpNode.OUTPUT, ret, ReturnNode.INPUT);
        NodeConnector.connect(add, BinaryOpNode.OUTPUT, ret, ReturnNode.INPUT);

        assertTrue(ret.input(ReturnNode.INPUT).orElseThrow().isUnresolved());
        assertEquals(1, ret.connectedInputs().size());
    }
}
