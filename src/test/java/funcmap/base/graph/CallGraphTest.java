package funcmap.base.graph;

import static org.junit.jupiter.api.Assertions.*;

import funcmap.base.Address;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class CallGraphTest {
    private static final Address MAIN = Address.of(0x1000);
    private static final Address F = Address.of(0x2000);
    private static final Address G = Address.of(0x3000);
    private static final Address H = Address.of(0x4000);

    @Test
    public void testNoParallelEdges() {
        var cg = new CallGraph();
        cg.addCall(MAIN, F);
        cg.addCall(MAIN, F);

        assertEquals(1, cg.getEdgeCount());
        assertTrue(cg.hasEdge(MAIN, F));
        assertEquals(Set.of(F), cg.getCallees(MAIN));
        assertEquals(Set.of(MAIN), cg.getCallers(F));
    }

    @Test
    public void testRootsAndLeaves() {
        var cg = new CallGraph();
        cg.addCall(MAIN, F);
        cg.addCall(MAIN, G);
        cg.addCall(F, G);

        assertEquals(Set.of(MAIN), cg.getRoots());
        assertEquals(Set.of(G), cg.getLeaves());
        assertTrue(cg.hasPath(MAIN, G));
        assertFalse(cg.hasPath(G, MAIN));
    }

    @Test
    public void testRecursiveGroups() {
        var cg = new CallGraph();
        cg.addCall(MAIN, F);
        cg.addCall(F, G);
        cg.addCall(G, F);
        cg.addCall(MAIN, H);
        cg.addCall(H, H);

        List<Set<Address>> groups = cg.getRecursiveGroups();
        assertEquals(2, groups.size());
        assertTrue(groups.contains(Set.of(F, G)));
        assertTrue(groups.contains(Set.of(H)));
    }

    @Test
    public void testJGraphTSnapshotIsDetached() {
        var cg = new CallGraph();
        cg.addCall(MAIN, F);

        var snapshot = cg.toJGraphT();
        assertEquals(2, snapshot.vertexSet().size());
        assertTrue(snapshot.containsEdge(MAIN, F));

        snapshot.addVertex(G);
        assertFalse(cg.containsNode(G));
    }
}
