package funcmap.base.graph;

import funcmap.base.Address;
import funcmap.utils.Logging;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.KosarajuStrongConnectivityInspector;
import org.jgrapht.alg.interfaces.StrongConnectivityAlgorithm;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Inter-procedural call graph. An edge A -> B means the function at entry A
 * executes at least one call whose target is B. Several call sites from A to
 * B collapse onto a single edge.
 */
public class CallGraph extends GraphBase<Address> implements CallGraphView {

    /**
     * Record that {@code caller} calls {@code callee}.
     * @param caller the entry address of the calling function
     * @param callee the call target
     */
    public void addCall(Address caller, Address callee) {
        if (addEdge(caller, callee)) {
            Logging.trace("CallGraph", String.format("Add call edge: %s -> %s", caller, callee));
        }
    }

    @Override
    public Set<Address> getCallees(Address caller) {
        return getSuccs(caller);
    }

    @Override
    public Set<Address> getCallers(Address callee) {
        return getPreds(callee);
    }

    @Override
    public Set<Address> getRoots() {
        Set<Address> res = new LinkedHashSet<>();
        for (var node : getAllNodes()) {
            if (((CallGraphNode) node).isRoot()) {
                res.add(node.value);
            }
        }
        return res;
    }

    @Override
    public Set<Address> getLeaves() {
        Set<Address> res = new LinkedHashSet<>();
        for (var node : getAllNodes()) {
            if (((CallGraphNode) node).isLeaf()) {
                res.add(node.value);
            }
        }
        return res;
    }

    @Override
    public List<Set<Address>> getRecursiveGroups() {
        Graph<Address, DefaultEdge> graph = toJGraphT();
        StrongConnectivityAlgorithm<Address, DefaultEdge> scAlg =
                new KosarajuStrongConnectivityInspector<>(graph);

        List<Set<Address>> groups = new ArrayList<>();
        for (Set<Address> component : scAlg.stronglyConnectedSets()) {
            if (component.size() > 1) {
                groups.add(component);
            } else {
                Address only = component.iterator().next();
                if (graph.containsEdge(only, only)) {
                    groups.add(component);
                }
            }
        }
        Logging.debug("CallGraph", String.format("Found %d recursive groups", groups.size()));
        return groups;
    }

    @Override
    public Graph<Address, DefaultEdge> toJGraphT() {
        Graph<Address, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        for (var node : getAllNodes()) {
            graph.addVertex(node.value);
        }
        for (var node : getAllNodes()) {
            for (var succ : node.succ) {
                graph.addEdge(node.value, succ.value);
            }
        }
        return graph;
    }

    @Override
    protected NodeBase<Address> createNode(Address value, int node_id) {
        return new CallGraphNode(value, node_id);
    }
}
