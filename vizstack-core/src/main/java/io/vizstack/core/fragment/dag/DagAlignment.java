package io.vizstack.core.fragment.dag;

import io.vizstack.core.fragment.option.AlignmentAxis;
import io.vizstack.core.fragment.option.Justify;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Group of DAG nodes the renderer should line up along one axis.
///
/// @param axis    axis the nodes are aligned on, not null
/// @param nodes   names of the aligned nodes, not null
/// @param justify justification along the axis, may be null
public record DagAlignment(AlignmentAxis axis, List<String> nodes, Justify justify) {

    public DagAlignment {
        Objects.requireNonNull(axis, "axis must not be null");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
    }

    public static DagAlignment of(AlignmentAxis axis, String... nodes) {
        return new DagAlignment(axis, List.of(nodes), null);
    }

    /// Returns a copy of this alignment with `node` placed first in the group.
    ///
    /// @param node node name to prepend, not null
    /// @return new alignment, never null
    public DagAlignment including(String node) {
        List<String> joined = new ArrayList<>(nodes.size() + 1);
        joined.add(node);
        joined.addAll(nodes);
        return new DagAlignment(axis, joined, justify);
    }
}
