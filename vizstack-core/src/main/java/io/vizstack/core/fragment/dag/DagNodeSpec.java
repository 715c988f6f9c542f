package io.vizstack.core.fragment.dag;

import io.vizstack.core.fragment.option.Direction;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Accumulated declaration of one DAG node, before its item is resolved.
///
/// @param parent        name of the enclosing node, or null at the top level
/// @param flowDirection direction of the node's children, may be null
/// @param alignChildren whether children are aligned on the flow axis, may be null
/// @param expanded      whether the child container is expanded, may be null
/// @param interactive   whether the node reacts to interaction, may be null
/// @param visible       whether the container boundary is drawn, may be null
/// @param ports         ports keyed by name, not null
public record DagNodeSpec(
        String parent,
        Direction flowDirection,
        Boolean alignChildren,
        Boolean expanded,
        Boolean interactive,
        Boolean visible,
        Map<String, DagPort> ports) {

    /// A node with no settings.
    public static final DagNodeSpec EMPTY =
            new DagNodeSpec(null, null, null, null, null, null, Map.of());

    public DagNodeSpec {
        ports = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(ports, "ports must not be null")));
    }

    /// Returns a copy of this node with the settings specified in `options` applied.
    ///
    /// @param options settings to apply, not null
    /// @return merged node declaration, never null
    public DagNodeSpec merge(DagNodeOptions options) {
        DagNodeSpec merged =
                new DagNodeSpec(
                        options.isParentSpecified() ? options.getParent() : parent,
                        firstNonNull(options.getFlowDirection(), flowDirection),
                        firstNonNull(options.getAlignChildren(), alignChildren),
                        firstNonNull(options.getExpanded(), expanded),
                        firstNonNull(options.getInteractive(), interactive),
                        firstNonNull(options.getVisible(), visible),
                        ports);
        for (Map.Entry<String, DagPort> port : options.getPorts().entrySet()) {
            merged = merged.withPort(port.getKey(), port.getValue());
        }
        return merged;
    }

    /// Returns a copy of this node with a port declared or updated.
    ///
    /// @param name port name, not null
    /// @param port port settings; non-null settings override an existing port's, not null
    /// @return updated node declaration, never null
    public DagNodeSpec withPort(String name, DagPort port) {
        Map<String, DagPort> updated = new LinkedHashMap<>(ports);
        updated.merge(name, port, DagPort::merge);
        return new DagNodeSpec(
                parent, flowDirection, alignChildren, expanded, interactive, visible, updated);
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
