package funcmap.base.graph;

import funcmap.base.Address;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A basic block in a function's transition graph.
 */
public class BlockNode extends NodeBase<Address> {

    /** Outgoing tagged edges, keyed by destination block */
    public final Map<Address, TransitionGraph.TransitionEdge> outEdges = new LinkedHashMap<>();

    public BlockNode(Address value, int id) {
        super(value, id);
    }
}
