package io.vizstack.core.fragment;

import io.vizstack.core.fragment.dag.DagAlignment;
import io.vizstack.core.fragment.dag.DagEdge;
import io.vizstack.core.fragment.dag.DagNodeOptions;
import io.vizstack.core.fragment.dag.DagNodeSpec;
import io.vizstack.core.fragment.dag.DagPort;
import io.vizstack.core.fragment.dag.DagValidator;
import io.vizstack.core.fragment.dag.EdgeEndpoint;
import io.vizstack.core.fragment.option.Direction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Arranges items as the nodes of a directed graph, with optional nesting and ports.
///
/// Contents:
/// - `nodes`, keyed by node name: `{fragmentId, children, flowDirection?, alignChildren?,
///   ports?, isExpanded?, isInteractive?, isVisible?}`, where `children` lists the names of
///   nodes whose parent is this node, in declaration order
/// - `edges`, keyed `"e0"`, `"e1"`, ... in declaration order: `{source: {id, port?},
///   target: {id, port?}, label?}`
/// - `alignments`: `[{axis, nodes, justify?}]`
/// - optional `flowDirection` and `alignChildren` for the top level
///
/// The item of node `name` is resolved under slot `"n" + name`. The whole declaration is
/// checked by {@link DagValidator} before any child id is issued.
///
/// {@snippet :
/// DagLayout dag = DagLayout.create(Direction.SOUTH)
///         .node("a", DagNodeOptions.create().port("out", Direction.SOUTH, null), text("a"))
///         .node("b", DagNodeOptions.create().port("in", Direction.NORTH, null), text("b"))
///         .edge(EdgeEndpoint.of("a", "out"), EdgeEndpoint.of("b", "in"));
/// }
public final class DagLayout extends FragmentAssembler {

    private final Map<String, DagNodeSpec> nodes = new LinkedHashMap<>();
    private final Map<String, Object> items = new LinkedHashMap<>();
    private final List<DagEdge> edges = new ArrayList<>();
    private final List<DagAlignment> alignments = new ArrayList<>();
    private Direction flowDirection;
    private Boolean alignChildren;

    private DagLayout() {}

    public static DagLayout create() {
        return new DagLayout();
    }

    /// Creates a DAG whose top-level nodes flow in the given direction.
    ///
    /// @param flowDirection top-level flow direction, may be null
    /// @return new DAG layout, never null
    public static DagLayout create(Direction flowDirection) {
        return new DagLayout().flowDirection(flowDirection);
    }

    public DagLayout flowDirection(Direction flowDirection) {
        this.flowDirection = flowDirection;
        return this;
    }

    public DagLayout alignChildren(Boolean alignChildren) {
        this.alignChildren = alignChildren;
        return this;
    }

    /// Declares a node with default settings, or leaves an existing node unchanged.
    ///
    /// @param name node name, not null
    /// @return this layout for chaining
    public DagLayout node(String name) {
        return node(name, DagNodeOptions.create());
    }

    /// Declares a node, or updates the settings specified in `options` on an existing node.
    ///
    /// Setting a new parent moves the node out of its previous parent's children.
    ///
    /// @param name    node name, not null
    /// @param options settings to apply, not null
    /// @return this layout for chaining
    public DagLayout node(String name, DagNodeOptions options) {
        Objects.requireNonNull(name, "node name must not be null");
        Objects.requireNonNull(options, "options must not be null");
        nodes.put(name, nodes.getOrDefault(name, DagNodeSpec.EMPTY).merge(options));
        for (DagAlignment alignment : options.getAlignWith()) {
            alignments.add(alignment.including(name));
        }
        return this;
    }

    /// Declares or updates a node and sets its item.
    ///
    /// @param name    node name, not null
    /// @param options settings to apply, not null
    /// @param item    content of the node, not null
    /// @return this layout for chaining
    public DagLayout node(String name, DagNodeOptions options, Object item) {
        return node(name, options).item(name, item);
    }

    /// Declares or updates a port on a node, declaring the node if needed.
    ///
    /// @param node  node name, not null
    /// @param port  port name, not null
    /// @param side  side of the node, may be null
    /// @param order position among ports on that side, may be null
    /// @return this layout for chaining
    public DagLayout port(String node, String port, Direction side, Integer order) {
        Objects.requireNonNull(node, "node name must not be null");
        Objects.requireNonNull(port, "port name must not be null");
        DagNodeSpec spec = nodes.getOrDefault(node, DagNodeSpec.EMPTY);
        nodes.put(node, spec.withPort(port, new DagPort(side, order)));
        return this;
    }

    public DagLayout edge(String source, String target) {
        return edge(EdgeEndpoint.of(source), EdgeEndpoint.of(target), null);
    }

    public DagLayout edge(EdgeEndpoint source, EdgeEndpoint target) {
        return edge(source, target, null);
    }

    /// Appends a directed edge. Endpoints are checked when the layout is assembled.
    ///
    /// @param source start node and optional port, not null
    /// @param target end node and optional port, not null
    /// @param label  edge label, may be null
    /// @return this layout for chaining
    public DagLayout edge(EdgeEndpoint source, EdgeEndpoint target, String label) {
        edges.add(new DagEdge(source, target, label));
        return this;
    }

    /// Adds an alignment group that does not belong to a single node declaration.
    ///
    /// @param alignment alignment group, not null
    /// @return this layout for chaining
    public DagLayout alignment(DagAlignment alignment) {
        alignments.add(Objects.requireNonNull(alignment, "alignment must not be null"));
        return this;
    }

    /// Sets or replaces the item shown in a node.
    ///
    /// @param name node name, not null
    /// @param item content of the node, not null
    /// @return this layout for chaining
    public DagLayout item(String name, Object item) {
        items.put(Objects.requireNonNull(name, "node name must not be null"), item);
        return this;
    }

    public Map<String, DagNodeSpec> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<DagEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    @Override
    public DagLayout meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.DAG_LAYOUT;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        DagValidator.validate(nodes, items.keySet(), edges, alignments);

        Map<String, List<String>> children = new LinkedHashMap<>();
        nodes.forEach(
                (name, node) -> {
                    if (node.parent() != null) {
                        children.computeIfAbsent(node.parent(), k -> new ArrayList<>()).add(name);
                    }
                });

        Map<String, Object> nodeContents = new LinkedHashMap<>();
        List<Object> references = new ArrayList<>(nodes.size());
        nodes.forEach(
                (name, node) -> {
                    Object item = items.get(name);
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("fragmentId", resolver.getId(item, "n" + name));
                    entry.put("children", children.getOrDefault(name, List.of()));
                    entry.put("flowDirection", wire(node.flowDirection()));
                    entry.put("alignChildren", node.alignChildren());
                    entry.put("ports", node.ports().isEmpty() ? null : portContents(node));
                    entry.put("isExpanded", node.expanded());
                    entry.put("isInteractive", node.interactive());
                    entry.put("isVisible", node.visible());
                    nodeContents.put(name, entry);
                    references.add(item);
                });

        Map<String, Object> edgeContents = new LinkedHashMap<>();
        for (int i = 0; i < edges.size(); i++) {
            DagEdge edge = edges.get(i);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("source", endpointContents(edge.source()));
            entry.put("target", endpointContents(edge.target()));
            entry.put("label", edge.label());
            edgeContents.put("e" + i, entry);
        }

        List<Map<String, Object>> alignmentContents = new ArrayList<>(alignments.size());
        for (DagAlignment alignment : alignments) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("axis", wire(alignment.axis()));
            entry.put("nodes", alignment.nodes());
            entry.put("justify", wire(alignment.justify()));
            alignmentContents.add(entry);
        }

        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("nodes", nodeContents);
        contents.put("edges", edgeContents);
        contents.put("alignments", alignmentContents);
        contents.put("flowDirection", wire(flowDirection));
        contents.put("alignChildren", alignChildren);
        return new Assembly(fragment(contents), references);
    }

    private static Map<String, Object> portContents(DagNodeSpec node) {
        Map<String, Object> ports = new LinkedHashMap<>();
        node.ports()
                .forEach(
                        (name, port) -> {
                            Map<String, Object> entry = new LinkedHashMap<>();
                            entry.put("side", wire(port.side()));
                            entry.put("order", port.order());
                            ports.put(name, entry);
                        });
        return ports;
    }

    private static Map<String, Object> endpointContents(EdgeEndpoint endpoint) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", endpoint.id());
        entry.put("port", endpoint.port());
        return entry;
    }
}
