package funcmap.base.graph;

import funcmap.base.Address;
import funcmap.utils.Logging;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Intra-procedural control flow of one function.
 * Nodes are basic block addresses, edges carry an {@link EdgeType} tag.
 */
public class TransitionGraph extends GraphBase<Address> implements TransitionGraphView {

    public enum EdgeType {
        /**
         * Transition graph has the following types of edges:
         * 1. Transition Edge: ordinary intra-function control flow, a fallthrough or a branch.
         * 2. ReturnFromCall Edge: control resumes in this function after a callee returns.
         */
        TRANSITION, RETURN_FROM_CALL
    }

    public static class TransitionEdge {
        public final Address src;
        public final Address dst;
        public final EdgeType edgeType;

        public TransitionEdge(Address src, Address dst, EdgeType edgeType) {
            this.src = Objects.requireNonNull(src);
            this.dst = Objects.requireNonNull(dst);
            this.edgeType = Objects.requireNonNull(edgeType);
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) {
                return true;
            }
            if (!(obj instanceof TransitionEdge other)) {
                return false;
            }
            return src.equals(other.src) && dst.equals(other.dst) && edgeType == other.edgeType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(src, dst, edgeType);
        }

        @Override
        public String toString() {
            return String.format("%s ---%s---> %s", src, edgeType, dst);
        }
    }

    /**
     * Add a basic block with no edges. No-op if it is already in the graph.
     * @param addr the block address
     */
    public void addBlock(Address addr) {
        getNode(addr);
    }

    /**
     * Add a tagged edge. Both endpoints become nodes of the graph.
     * The graph stays simple: adding an existing (from, to) pair again keeps
     * a single edge carrying the latest tag.
     * @param from the block control flow leaves
     * @param to the block control flow enters
     * @param edgeType the tag of the edge
     */
    public void addEdge(Address from, Address to, EdgeType edgeType) {
        super.addEdge(from, to);
        BlockNode src = (BlockNode) getNode(from);
        TransitionEdge old = src.outEdges.get(to);
        if (old != null && old.edgeType == edgeType) {
            return;
        }
        TransitionEdge edge = new TransitionEdge(from, to, edgeType);
        src.outEdges.put(to, edge);
        if (old != null) {
            Logging.debug("TransitionGraph", String.format("Retag edge %s -> %s: %s => %s", from, to, old.edgeType, edgeType));
        } else {
            Logging.trace("TransitionGraph", "Add edge: " + edge);
        }
    }

    /**
     * Untagged edges are ordinary transitions.
     */
    @Override
    public boolean addEdge(Address from, Address to) {
        boolean isNew = !hasEdge(from, to);
        addEdge(from, to, EdgeType.TRANSITION);
        return isNew;
    }

    @Override
    public List<TransitionEdge> getEdges() {
        List<TransitionEdge> edges = new ArrayList<>();
        for (NodeBase<Address> node : getAllNodes()) {
            edges.addAll(((BlockNode) node).outEdges.values());
        }
        return edges;
    }

    @Override
    public Optional<TransitionEdge> getEdge(Address from, Address to) {
        NodeBase<Address> src = findNode(from);
        if (src == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(((BlockNode) src).outEdges.get(to));
    }

    @Override
    protected NodeBase<Address> createNode(Address value, int node_id) {
        return new BlockNode(value, node_id);
    }
}
