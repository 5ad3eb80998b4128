package funcmap.base.graph;

import funcmap.base.Address;

/**
 * A function entry or call target in the inter-procedural call graph.
 */
public class CallGraphNode extends NodeBase<Address> {

    public CallGraphNode(Address value, int id) {
        super(value, id);
    }

    /** Whether the node calls nothing */
    public boolean isLeaf() {
        return succ.isEmpty();
    }

    /** Whether nothing calls the node */
    public boolean isRoot() {
        return pred.isEmpty();
    }
}
