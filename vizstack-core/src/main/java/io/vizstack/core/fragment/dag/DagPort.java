package io.vizstack.core.fragment.dag;

import io.vizstack.core.fragment.option.Direction;

/// Named attachment point on the boundary of a DAG node.
///
/// @param side  side of the node the port sits on, may be null for the renderer default
/// @param order position among ports on the same side, may be null
public record DagPort(Direction side, Integer order) {

    /// Returns a port with this port's settings overridden by the non-null settings of `other`.
    ///
    /// @param other settings to apply, not null
    /// @return merged port, never null
    public DagPort merge(DagPort other) {
        return new DagPort(
                other.side != null ? other.side : side, other.order != null ? other.order : order);
    }
}
