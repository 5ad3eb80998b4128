package funcmap.base.graph;

import funcmap.base.Address;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to a function's intra-procedural transition graph.
 */
public interface TransitionGraphView extends GraphView<Address> {

    /** All tagged edges, grouped by source block in insertion order. */
    List<TransitionGraph.TransitionEdge> getEdges();

    Optional<TransitionGraph.TransitionEdge> getEdge(Address from, Address to);
}
