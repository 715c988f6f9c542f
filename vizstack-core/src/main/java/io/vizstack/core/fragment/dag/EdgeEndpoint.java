package io.vizstack.core.fragment.dag;

import java.util.Objects;

/// One end of a DAG edge: a node name and, optionally, one of that node's ports.
///
/// @param id   name of the DAG node, not null
/// @param port name of a port declared on that node, may be null
public record EdgeEndpoint(String id, String port) {

    public EdgeEndpoint {
        Objects.requireNonNull(id, "edge endpoint node must not be null");
    }

    public static EdgeEndpoint of(String id) {
        return new EdgeEndpoint(id, null);
    }

    public static EdgeEndpoint of(String id, String port) {
        return new EdgeEndpoint(id, port);
    }
}
