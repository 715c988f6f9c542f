package io.vizstack.core.fragment.dag;

import io.vizstack.core.fragment.option.Direction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Settings applied to a DAG node by one call to
/// {@link io.vizstack.core.fragment.DagLayout#node(String, DagNodeOptions)}.
///
/// A node may be configured by several calls; each call only changes the settings it
/// specifies. Unset settings (null) leave the node's current value alone. The parent is
/// tri-state: untouched, set with {@link #parent(String)}, or removed with {@link #noParent()}.
///
/// @implNote Not thread-safe. Intended to be built and passed inline.
public final class DagNodeOptions {

    private boolean parentSpecified;
    private String parent;
    private Direction flowDirection;
    private Boolean alignChildren;
    private Boolean expanded;
    private Boolean interactive;
    private Boolean visible;
    private final Map<String, DagPort> ports = new LinkedHashMap<>();
    private final List<DagAlignment> alignWith = new ArrayList<>();

    private DagNodeOptions() {}

    /// Creates options that change nothing.
    ///
    /// @return new empty options, never null
    public static DagNodeOptions create() {
        return new DagNodeOptions();
    }

    /// Nests the node inside `parent`.
    ///
    /// @param parent name of the parent node, not null
    /// @return these options for chaining
    public DagNodeOptions parent(String parent) {
        this.parentSpecified = true;
        this.parent = Objects.requireNonNull(parent, "parent must not be null, use noParent()");
        return this;
    }

    /// Moves the node to the top level.
    ///
    /// @return these options for chaining
    public DagNodeOptions noParent() {
        this.parentSpecified = true;
        this.parent = null;
        return this;
    }

    /// Sets the direction in which this node's children flow.
    ///
    /// @param flowDirection flow direction, not null
    /// @return these options for chaining
    public DagNodeOptions flowDirection(Direction flowDirection) {
        this.flowDirection = flowDirection;
        return this;
    }

    public DagNodeOptions alignChildren(boolean alignChildren) {
        this.alignChildren = alignChildren;
        return this;
    }

    /// Sets whether the node's child container starts expanded.
    ///
    /// @param expanded true to expand
    /// @return these options for chaining
    public DagNodeOptions expanded(boolean expanded) {
        this.expanded = expanded;
        return this;
    }

    public DagNodeOptions interactive(boolean interactive) {
        this.interactive = interactive;
        return this;
    }

    /// Sets whether the node's container boundary is drawn.
    ///
    /// @param visible true to draw the boundary
    /// @return these options for chaining
    public DagNodeOptions visible(boolean visible) {
        this.visible = visible;
        return this;
    }

    /// Declares a port on the node.
    ///
    /// @param name  port name, not null
    /// @param side  side of the node, may be null
    /// @param order position among ports on that side, may be null
    /// @return these options for chaining
    public DagNodeOptions port(String name, Direction side, Integer order) {
        Objects.requireNonNull(name, "port name must not be null");
        ports.put(name, new DagPort(side, order));
        return this;
    }

    /// Aligns the node with the nodes of `alignment`; the node is prepended to the group.
    ///
    /// @param alignment alignment group, not null
    /// @return these options for chaining
    public DagNodeOptions alignWith(DagAlignment alignment) {
        alignWith.add(Objects.requireNonNull(alignment, "alignment must not be null"));
        return this;
    }

    public boolean isParentSpecified() {
        return parentSpecified;
    }

    public String getParent() {
        return parent;
    }

    public Direction getFlowDirection() {
        return flowDirection;
    }

    public Boolean getAlignChildren() {
        return alignChildren;
    }

    public Boolean getExpanded() {
        return expanded;
    }

    public Boolean getInteractive() {
        return interactive;
    }

    public Boolean getVisible() {
        return visible;
    }

    public Map<String, DagPort> getPorts() {
        return Collections.unmodifiableMap(ports);
    }

    public List<DagAlignment> getAlignWith() {
        return Collections.unmodifiableList(alignWith);
    }
}
