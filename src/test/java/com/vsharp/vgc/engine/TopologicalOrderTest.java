package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.CycleDetectedException;
import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.ValueType;
import com.vsharp.vgc.node.BinaryOpNode;
import com.vsharp.vgc.node.ClassDefinitionNode;
import com.vsharp.vgc.node.LiteralNode;
import com.vsharp.vgc.node.ReturnNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class TopologicalOrderTest {

    private static LiteralNode literal(int v) {
        return new LiteralNode(ValueType.INT, v);
    }

    private static void link(GraphNode from, GraphNode to, String input) {
        NodeConnector.connect(from, from.outputs().get(0).name(), to, input);
    }

    @Test
    public void testEmptyGraph() {
        TopologicalOrder order = TopologicalOrder.of(List.of());
        assertEquals(0, order.nodeCount());
        assertTrue(TopologicalOrder.sort(List.of()).isEmpty());
    }

    @Test
    public void testSingleNode() {
        LiteralNode a = literal(1);
        TopologicalOrder order = TopologicalOrder.of(List.of(a));

        assertEquals(1, order.nodeCount());
        assertSame(a, order.node(0));
        assertEquals(0, order.topoIndex(a.id()));
        assertEquals(0, order.childCount(0));
        assertEquals(0, order.parentCount(0));
    }

    @Test
    public void testLinearGraphGivenInReverse() {
        // a -> add.A, b -> add.B, add -> ret
        LiteralNode a = literal(1);
        LiteralNode b = literal(2);
        BinaryOpNode add = BinaryOpNode.add();
        ReturnNode ret = new ReturnNode(ValueType.INT);
        link(a, add, BinaryOpNode.LEFT);
        link(b, add, BinaryOpNode.RIGHT);
        link(add, ret, ReturnNode.INPUT);

        List<GraphNode> sorted = TopologicalOrder.sort(List.of(ret, add, b, a));

        assertEquals(4, sorted.size());
        assertSame(ret, sorted.get(3));
        assertSame(add, sorted.get(2));
        assertTrue(sorted.subList(0, 2).containsAll(List.of(a, b)));
    }

    @Test
    public void testDiamondGraph() {
        // a feeds both x and y, which feed z
        LiteralNode a = literal(1);
        BinaryOpNode x = BinaryOpNode.add();
        BinaryOpNode y = BinaryOpNode.add();
        BinaryOpNode z = BinaryOpNode.add();
        link(a, x, BinaryOpNode.LEFT);
        link(a, x, BinaryOpNode.RIGHT);
        link(a, y, BinaryOpNode.LEFT);
        link(a, y, BinaryOpNode.RIGHT);
        link(x, z, BinaryOpNode.LEFT);
        link(y, z, BinaryOpNode.RIGHT);

        TopologicalOrder order = TopologicalOrder.of(List.of(z, y, x, a));

        assertEquals(0, order.topoIndex(a.id()));
        int idxX = order.topoIndex(x.id());
        int idxY = order.topoIndex(y.id());
        int idxZ = order.topoIndex(z.id());
        assertTrue(idxZ > idxX);
        assertTrue(idxZ > idxY);

        // x uses a twice but depends on it once
        assertEquals(2, order.childCount(0));
        assertEquals(1, order.parentCount(idxX));
        assertEquals(2, order.parentCount(idxZ));
        assertEquals(idxZ, order.child(idxX, 0));
    }

    @Test
    public void testIndependentNodesKeepInputOrder() {
        LiteralNode a = literal(1);
        LiteralNode b = literal(2);
        LiteralNode c = literal(3);

        assertEquals(List.of(b, c, a), TopologicalOrder.sort(List.of(b, c, a)));
    }

    @Test
    public void testDefinitionNodesAreScheduled() {
        ClassDefinitionNode point = new ClassDefinitionNode("Point");
        LiteralNode a = literal(1);

        List<GraphNode> sorted = TopologicalOrder.sort(List.of(point, a));
        assertEquals(2, sorted.size());
        assertTrue(sorted.contains(point));
    }

    @Test
    public void testSortDoesNotMutateNodes() {
        LiteralNode a = literal(1);
        ReturnNode ret = new ReturnNode(ValueType.INT);
        link(a, ret, ReturnNode.INPUT);
        var before = ret.connectedInputs().toString();

        TopologicalOrder.sort(List.of(ret, a));
        assertEquals(before, ret.connectedInputs().toString());
    }

    @Test
    public void testCycleDetection() {
        // x -> y -> z -> x
        BinaryOpNode x = BinaryOpNode.add();
        BinaryOpNode y = BinaryOpNode.add();
        BinaryOpNode z = BinaryOpNode.add();
        link(x, y, BinaryOpNode.LEFT);
        link(y, z, BinaryOpNode.LEFT);
        link(z, x, BinaryOpNode.LEFT);

        try {
            TopologicalOrder.sort(List.of(x, y, z));
            fail("Expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(3, e.unresolvedIds().size());
            assertTrue(e.getMessage().contains("Processed 0 of 3"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testSelfLoopDetection() {
        BinaryOpNode x = BinaryOpNode.add();
        link(x, x, BinaryOpNode.LEFT);

        TopologicalOrder.sort(List.of(x));
    }

    @Test
    public void testCycleDownstreamNodesAreReported() {
        LiteralNode a = literal(1);
        BinaryOpNode x = BinaryOpNode.add();
        BinaryOpNode y = BinaryOpNode.add();
        ReturnNode ret = new ReturnNode(ValueType.INT);
        link(a, x, BinaryOpNode.LEFT);
        link(y, x, BinaryOpNode.RIGHT);
        link(x, y, BinaryOpNode.LEFT);
        link(y, ret, ReturnNode.INPUT);

        try {
            TopologicalOrder.sort(List.of(a, x, y, ret));
            fail("Expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(3, e.unresolvedIds().size());
            assertTrue(e.getMessage().contains("Processed 1 of 4"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeException() {
        LiteralNode a = literal(1);
        TopologicalOrder.sort(List.of(a, a));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProducerOutsideNodeSetException() {
        LiteralNode a = literal(1);
        ReturnNode ret = new ReturnNode(ValueType.INT);
        link(a, ret, ReturnNode.INPUT);

        TopologicalOrder.sort(List.of(ret));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTopoIndexLookup() {
        TopologicalOrder order = TopologicalOrder.of(List.of(literal(1)));
        order.topoIndex("UNKNOWN");
    }

    @Test
    public void testRandomChainsRespectDependencies() {
        // Layered graph: each add consumes two nodes from earlier layers
        java.util.Random rnd = new java.util.Random(42);
        List<GraphNode> nodes = new ArrayList<>();
        for (int i = 0; i < 5; i++)
            nodes.add(literal(i));
        for (int i = 0; i < 40; i++) {
            BinaryOpNode add = BinaryOpNode.add();
            link(nodes.get(rnd.nextInt(nodes.size())), add, BinaryOpNode.LEFT);
            link(nodes.get(rnd.nextInt(nodes.size())), add, BinaryOpNode.RIGHT);
            nodes.add(add);
        }
        List<GraphNode> shuffled = new ArrayList<>(nodes);
        java.util.Collections.shuffle(shuffled, rnd);

        TopologicalOrder order = TopologicalOrder.of(shuffled);
        assertEquals(nodes.size(), order.nodeCount());
        for (GraphNode n : nodes) {
            int idx = order.topoIndex(n.id());
            for (var ref : n.connectedInputs().values())
                assertTrue(order.topoIndex(ref.producerId()) < idx);
        }
    }
}
