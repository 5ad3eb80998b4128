package funcmap.base.graph;

import static org.junit.jupiter.api.Assertions.*;

import funcmap.base.Address;
import funcmap.base.graph.TransitionGraph.EdgeType;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class TransitionGraphTest {
    private static final Address A = Address.of(0x1000);
    private static final Address B = Address.of(0x1010);
    private static final Address C = Address.of(0x1020);

    @Test
    public void testEdgesAddEndpoints() {
        var graph = new TransitionGraph();
        graph.addEdge(A, B, EdgeType.TRANSITION);

        assertEquals(Set.of(A, B), graph.getNodes());
        assertTrue(graph.hasEdge(A, B));
        assertFalse(graph.hasEdge(B, A));
        assertEquals(Set.of(B), graph.getSuccs(A));
        assertEquals(Set.of(A), graph.getPreds(B));
    }

    @Test
    public void testDuplicateEdgeIsIgnored() {
        var graph = new TransitionGraph();
        graph.addEdge(A, B, EdgeType.TRANSITION);
        graph.addEdge(A, B, EdgeType.TRANSITION);

        assertEquals(1, graph.getEdgeCount());
        assertEquals(1, graph.getEdges().size());
    }

    @Test
    public void testLastTagWins() {
        var graph = new TransitionGraph();
        graph.addEdge(A, B, EdgeType.TRANSITION);
        graph.addEdge(A, B, EdgeType.RETURN_FROM_CALL);

        assertEquals(1, graph.getEdgeCount());
        assertEquals(EdgeType.RETURN_FROM_CALL, graph.getEdge(A, B).orElseThrow().edgeType);
    }

    @Test
    public void testBlocksAndQueriesDoNotCreateNodes() {
        var graph = new TransitionGraph();
        graph.addBlock(A);
        graph.addBlock(A);

        assertEquals(1, graph.getNodeCount());
        assertTrue(graph.getSuccs(C).isEmpty());
        assertTrue(graph.getEdge(C, A).isEmpty());
        assertFalse(graph.hasPath(A, C));
        assertFalse(graph.containsNode(C));
    }

    @Test
    public void testEdgeOrderAndPath() {
        var graph = new TransitionGraph();
        graph.addEdge(A, B);
        graph.addEdge(B, C, EdgeType.RETURN_FROM_CALL);

        List<TransitionGraph.TransitionEdge> edges = graph.getEdges();
        assertEquals(new TransitionGraph.TransitionEdge(A, B, EdgeType.TRANSITION), edges.get(0));
        assertEquals(new TransitionGraph.TransitionEdge(B, C, EdgeType.RETURN_FROM_CALL), edges.get(1));
        assertTrue(graph.hasPath(A, C));
        assertFalse(graph.hasPath(C, A));
        assertFalse(graph.hasPath(A, A));
    }
}
