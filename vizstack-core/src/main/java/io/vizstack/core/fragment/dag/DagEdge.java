package io.vizstack.core.fragment.dag;

import java.util.Objects;

/// Directed edge between two DAG nodes.
///
/// @param source start of the edge, not null
/// @param target end of the edge, not null
/// @param label  text shown on the edge, may be null
public record DagEdge(EdgeEndpoint source, EdgeEndpoint target, String label) {

    public DagEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }
}
