package io.vizstack.core.fragment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vizstack.core.VizstackFactory;
import io.vizstack.core.exception.DanglingReferenceException;
import io.vizstack.core.exception.MissingItemException;
import io.vizstack.core.fragment.dag.DagAlignment;
import io.vizstack.core.fragment.dag.DagNodeOptions;
import io.vizstack.core.fragment.dag.EdgeEndpoint;
import io.vizstack.core.fragment.option.AlignmentAxis;
import io.vizstack.core.fragment.option.Direction;
import io.vizstack.core.fragment.option.Justify;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DagLayout")
class DagLayoutTest {

    private final List<String> slots = new ArrayList<>();
    private final FragmentIdResolver resolver =
            (child, slot) -> {
                slots.add(slot);
                return FragmentId.of("id-" + slot);
            };

    @Test
    @DisplayName("emits nodes, derived children, edges and alignments")
    void shouldEmitFullContents() {
        DagAlignment alignment = new DagAlignment(AlignmentAxis.X, List.of("c"), Justify.NORTH);
        DagLayout dag =
                DagLayout.create(Direction.EAST)
                        .alignChildren(true)
                        .node(
                                "a",
                                DagNodeOptions.create()
                                        .flowDirection(Direction.SOUTH)
                                        .expanded(true)
                                        .port("out", Direction.SOUTH, 1),
                                TextPrimitive.of("a"))
                        .node(
                                "b",
                                DagNodeOptions.create()
                                        .parent("a")
                                        .alignWith(alignment),
                                TextPrimitive.of("b"))
                        .node("c", DagNodeOptions.create().parent("a"), TextPrimitive.of("c"))
                        .edge(EdgeEndpoint.of("a", "out"), EdgeEndpoint.of("b"), "calls");

        Assembly assembly = dag.assemble(resolver);
        Map<String, Object> contents = assembly.fragment().contents();

        assertThat(slots).containsExactly("na", "nb", "nc");
        assertThat(assembly.references()).hasSize(3);
        assertThat(contents)
                .containsEntry("flowDirection", "east")
                .containsEntry("alignChildren", true);

        Map<String, Object> nodes = asMap(contents.get("nodes"));
        assertThat(nodes.keySet()).containsExactly("a", "b", "c");
        assertThat(asMap(nodes.get("a")))
                .containsEntry("fragmentId", FragmentId.of("id-na"))
                .containsEntry("children", List.of("b", "c"))
                .containsEntry("flowDirection", "south")
                .containsEntry("isExpanded", true)
                .containsEntry("ports", Map.of("out", Map.of("side", "south", "order", 1)))
                .doesNotContainKeys("isVisible", "isInteractive", "alignChildren");
        assertThat(asMap(nodes.get("b")))
                .containsEntry("children", List.of())
                .doesNotContainKey("ports");

        assertThat(contents.get("edges"))
                .isEqualTo(
                        Map.of(
                                "e0",
                                Map.of(
                                        "source", Map.of("id", "a", "port", "out"),
                                        "target", Map.of("id", "b"),
                                        "label", "calls")));
        assertThat(contents.get("alignments"))
                .isEqualTo(
                        List.of(
                                Map.of(
                                        "axis", "x",
                                        "nodes", List.of("b", "c"),
                                        "justify", "north")));
    }

    @Test
    @DisplayName("moves a re-parented node to its new parent")
    void shouldReparent() {
        DagLayout dag =
                DagLayout.create()
                        .node("p", DagNodeOptions.create(), TextPrimitive.of("p"))
                        .node("q", DagNodeOptions.create(), TextPrimitive.of("q"))
                        .node("c", DagNodeOptions.create().parent("p"), TextPrimitive.of("c"))
                        .node("c", DagNodeOptions.create().parent("q"));

        Map<String, Object> nodes = nodesOf(dag.assemble(resolver));

        assertThat(asMap(nodes.get("p"))).containsEntry("children", List.of());
        assertThat(asMap(nodes.get("q"))).containsEntry("children", List.of("c"));
    }

    @Test
    @DisplayName("keeps settings not named by a later update")
    void shouldMergeUpdates() {
        DagLayout dag =
                DagLayout.create()
                        .node("p", DagNodeOptions.create(), TextPrimitive.of("p"))
                        .node(
                                "c",
                                DagNodeOptions.create().parent("p").visible(false),
                                TextPrimitive.of("c"))
                        .node("c", DagNodeOptions.create().interactive(true));

        Map<String, Object> nodes = nodesOf(dag.assemble(resolver));

        assertThat(asMap(nodes.get("c")))
                .containsEntry("isVisible", false)
                .containsEntry("isInteractive", true);
        assertThat(asMap(nodes.get("p"))).containsEntry("children", List.of("c"));
    }

    @Test
    @DisplayName("declares a node when a port is added to it")
    void shouldAutoDeclareNodeForPort() {
        DagLayout dag = DagLayout.create().port("n", "in", Direction.NORTH, null);

        assertThat(dag.getNodes()).containsKey("n");
        assertThatThrownBy(() -> dag.assemble(resolver))
                .isInstanceOf(MissingItemException.class)
                .hasMessageContaining("'n'");
    }

    @Test
    @DisplayName("fails on an edge to an undeclared port before issuing ids")
    void shouldRejectUnknownPort() {
        DagLayout dag =
                DagLayout.create()
                        .node("a", DagNodeOptions.create(), TextPrimitive.of("a"))
                        .node("b", DagNodeOptions.create(), TextPrimitive.of("b"))
                        .edge(EdgeEndpoint.of("a"), EdgeEndpoint.of("b", "missing"));

        assertThatThrownBy(() -> VizstackFactory.assemble(dag))
                .isInstanceOf(DanglingReferenceException.class)
                .hasMessageContaining("port 'missing'")
                .hasMessageContaining("node 'b'");
        assertThatThrownBy(() -> dag.assemble(resolver))
                .isInstanceOf(DanglingReferenceException.class);
        assertThat(slots).isEmpty();
    }

    @Test
    @DisplayName("resolves node items with digest ids under the root")
    void shouldUseNodeSlots() {
        DagLayout dag =
                DagLayout.create().node("A", DagNodeOptions.create(), TextPrimitive.of("x"));

        View view = VizstackFactory.assemble(dag);

        FragmentId expected = FragmentId.of("-ezUttLwaR");
        assertThat(view.fragments()).containsKey(expected);
        assertThat(asMap(asMap(view.root().contents().get("nodes")).get("A")))
                .containsEntry("fragmentId", expected);
    }

    @Test
    @DisplayName("lets a node contain the dag itself")
    void shouldAllowSelfReference() {
        DagLayout dag = DagLayout.create();
        dag.node("self", DagNodeOptions.create(), dag);

        View view = VizstackFactory.assemble(dag);

        assertThat(view.size()).isEqualTo(1);
    }

    private static Map<String, Object> nodesOf(Assembly assembly) {
        return asMap(assembly.fragment().contents().get("nodes"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
