package io.vizstack.core.fragment.dag;

import io.vizstack.core.exception.DanglingReferenceException;
import io.vizstack.core.exception.MissingItemException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Referential-integrity checks run on a DAG layout before its fragment is emitted.
///
/// ### Checks
/// - every declared node has an item ({@link MissingItemException})
/// - every declared parent names a declared node
/// - every edge starts and ends at declared nodes
/// - every port named by an edge is declared on the corresponding node
/// - every node named by an alignment group is declared
///
/// All dangling references raise {@link DanglingReferenceException}. The first violation found
/// aborts validation.
///
/// @implNote Stateless and thread-safe.
public final class DagValidator {

    private DagValidator() {}

    /// Validates a DAG declaration.
    ///
    /// @param nodes      declared nodes keyed by name, not null
    /// @param itemNames  names of nodes that were given an item, not null
    /// @param edges      declared edges in declaration order, not null
    /// @param alignments declared alignment groups, not null
    /// @throws MissingItemException if a node has no item
    /// @throws DanglingReferenceException if a parent, edge endpoint, port or alignment
    ///     member is not declared
    public static void validate(
            Map<String, DagNodeSpec> nodes,
            Set<String> itemNames,
            List<DagEdge> edges,
            List<DagAlignment> alignments) {
        for (Map.Entry<String, DagNodeSpec> entry : nodes.entrySet()) {
            String name = entry.getKey();
            if (!itemNames.contains(name)) {
                throw new MissingItemException(
                        "No item was provided for node '" + name + "'", name);
            }
            String parent = entry.getValue().parent();
            if (parent != null && !nodes.containsKey(parent)) {
                throw new DanglingReferenceException(
                        "Parent node '" + parent + "' not found for child '" + name + "'", parent);
            }
        }

        for (int i = 0; i < edges.size(); i++) {
            DagEdge edge = edges.get(i);
            checkEndpoint(nodes, edge.source(), "starts", "e" + i);
            checkEndpoint(nodes, edge.target(), "ends", "e" + i);
        }

        for (DagAlignment alignment : alignments) {
            for (String node : alignment.nodes()) {
                if (!nodes.containsKey(node)) {
                    throw new DanglingReferenceException(
                            "Alignment references unknown node '" + node + "'", node);
                }
            }
        }
    }

    private static void checkEndpoint(
            Map<String, DagNodeSpec> nodes, EdgeEndpoint endpoint, String verb, String edgeId) {
        DagNodeSpec node = nodes.get(endpoint.id());
        if (node == null) {
            throw new DanglingReferenceException(
                    "Edge '" + edgeId + "' " + verb + " at unknown node '" + endpoint.id() + "'",
                    endpoint.id());
        }
        if (endpoint.port() != null && !node.ports().containsKey(endpoint.port())) {
            throw new DanglingReferenceException(
                    "Edge '"
                            + edgeId
                            + "' "
                            + verb
                            + " at unknown port '"
                            + endpoint.port()
                            + "' on node '"
                            + endpoint.id()
                            + "'",
                    endpoint.port());
        }
    }
}
