package io.vizstack.core.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.vizstack.core.VizstackFactory;
import io.vizstack.core.assembly.spi.DefaultViewResolver;
import io.vizstack.core.assembly.spi.RejectingDefaultViewResolver;
import io.vizstack.core.exception.AssemblyException;
import io.vizstack.core.exception.MissingItemException;
import io.vizstack.core.exception.UnsupportedValueException;
import io.vizstack.core.fragment.FlowLayout;
import io.vizstack.core.fragment.Fragment;
import io.vizstack.core.fragment.FragmentId;
import io.vizstack.core.fragment.FragmentType;
import io.vizstack.core.fragment.KeyValueLayout;
import io.vizstack.core.fragment.SequenceLayout;
import io.vizstack.core.fragment.SwitchLayout;
import io.vizstack.core.fragment.TextPrimitive;
import io.vizstack.core.fragment.View;
import io.vizstack.core.fragment.Viewable;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("ViewAssembler")
@ExtendWith(MockitoExtension.class)
class ViewAssemblerTest {

    private static final FragmentId ID_0 = FragmentId.of("OZb3FBqdia");
    private static final FragmentId ID_1 = FragmentId.of("iFFzkzVSDF");

    private final ViewAssembler assembler = VizstackFactory.createAssembler();

    @Mock private DefaultViewResolver defaultViewResolver;

    @Nested
    @DisplayName("basic assembly")
    class Basic {

        @Test
        @DisplayName("emits a single fragment for a primitive root")
        void shouldAssembleLeafRoot() {
            View view = assembler.assemble(TextPrimitive.of("hello"));

            assertThat(view.rootId()).isEqualTo(FragmentId.ROOT);
            assertThat(view.size()).isEqualTo(1);
            assertThat(view.root().type()).isEqualTo(FragmentType.TEXT_PRIMITIVE);
            assertThat(view.root().contents()).containsExactly(Map.entry("text", "hello"));
        }

        @Test
        @DisplayName("flattens a sequence of two texts into three fragments")
        void shouldAssembleSequence() {
            View view =
                    assembler.assemble(
                            SequenceLayout.of(
                                    TextPrimitive.of("hello"), TextPrimitive.of("there")));

            assertThat(view.fragments()).containsOnlyKeys(FragmentId.ROOT, ID_0, ID_1);
            assertThat(view.root().contents()).containsEntry("elements", List.of(ID_0, ID_1));
            assertThat(view.getFragment(ID_0).orElseThrow().contents())
                    .containsEntry("text", "hello");
            assertThat(view.getFragment(ID_1).orElseThrow().contents())
                    .containsEntry("text", "there");
        }

        @Test
        @DisplayName("keeps the root first and later fragments in discovery order")
        void shouldKeepTableOrder() {
            View view =
                    assembler.assemble(
                            SequenceLayout.of(TextPrimitive.of("a"), TextPrimitive.of("b")));

            assertThat(view.fragments().keySet()).containsExactly(FragmentId.ROOT, ID_0, ID_1);
        }

        @Test
        @DisplayName("derives nested ids from the parent id")
        void shouldDeriveNestedIds() {
            View view =
                    assembler.assemble(SequenceLayout.of(SequenceLayout.of(TextPrimitive.of("x"))));

            FragmentId nested = FragmentId.of("zW0rfVDNID");
            assertThat(view.getFragment(ID_0).orElseThrow().contents())
                    .containsEntry("elements", List.of(nested));
            assertThat(view.getFragment(nested)).isPresent();
        }

        @Test
        @DisplayName("copies meta annotations into the fragment")
        void shouldCopyMeta() {
            View view = assembler.assemble(TextPrimitive.of("a").meta("source", "line 3"));

            assertThat(view.root().meta()).containsExactly(Map.entry("source", "line 3"));
        }

        @Test
        @DisplayName("produces equal views for equal graphs")
        void shouldBeDeterministic() {
            View first = assembler.assemble(sampleGraph());
            View second = assembler.assemble(sampleGraph());

            assertThat(second).isEqualTo(first);
        }

        private SequenceLayout sampleGraph() {
            TextPrimitive shared = TextPrimitive.of("shared");
            return SequenceLayout.of(
                    shared,
                    KeyValueLayout.create().item(TextPrimitive.of("k"), shared),
                    FlowLayout.of(TextPrimitive.of("f"), shared));
        }
    }

    @Nested
    @DisplayName("sharing and cycles")
    class SharingAndCycles {

        @Test
        @DisplayName("emits one fragment for a child referenced twice")
        void shouldShareRepeatedChild() {
            TextPrimitive text = TextPrimitive.of("x");

            View view = assembler.assemble(SequenceLayout.of(text, text));

            assertThat(view.size()).isEqualTo(2);
            assertThat(view.root().contents()).containsEntry("elements", List.of(ID_0, ID_0));
        }

        @Test
        @DisplayName("emits distinct fragments for equal but distinct children")
        void shouldNotMergeEqualChildren() {
            SequenceLayout twins = SequenceLayout.of(TextPrimitive.of("x"), TextPrimitive.of("x"));

            View view = assembler.assemble(twins);

            assertThat(view.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("shares a child reached through different parents")
        void shouldShareAcrossParents() {
            TextPrimitive shared = TextPrimitive.of("shared");
            SequenceLayout left = SequenceLayout.of(shared);
            SequenceLayout right = SequenceLayout.of(shared);

            View view = assembler.assemble(FlowLayout.of(left, right));

            assertThat(view.size()).isEqualTo(4);
            List<?> leftElements =
                    (List<?>) view.getFragment(ID_0).orElseThrow().contents().get("elements");
            List<?> rightElements =
                    (List<?>) view.getFragment(ID_1).orElseThrow().contents().get("elements");
            assertThat(leftElements).isEqualTo(rightElements);
        }

        @Test
        @DisplayName("resolves a sequence that contains itself to the root id")
        void shouldResolveSelfReference() {
            SequenceLayout sequence = SequenceLayout.create();
            sequence.item(sequence);

            View view = assembler.assemble(sequence);

            assertThat(view.size()).isEqualTo(1);
            assertThat(view.root().contents())
                    .containsEntry("elements", List.of(FragmentId.ROOT));
        }

        @Test
        @DisplayName("terminates on a cycle through intermediate nodes")
        void shouldResolveIndirectCycle() {
            SequenceLayout outer = SequenceLayout.create();
            SequenceLayout inner = SequenceLayout.of(outer);
            outer.item(inner);

            View view = assembler.assemble(outer);

            assertThat(view.size()).isEqualTo(2);
            assertThat(view.root().contents()).containsEntry("elements", List.of(ID_0));
            assertThat(view.getFragment(ID_0).orElseThrow().contents())
                    .containsEntry("elements", List.of(FragmentId.ROOT));
        }

        @Test
        @DisplayName("references only ids present in the table")
        void shouldBeClosed() {
            SequenceLayout a = SequenceLayout.create();
            SequenceLayout b = SequenceLayout.of(a, TextPrimitive.of("b"));
            a.items(b, TextPrimitive.of("a"), b);

            View view = assembler.assemble(a);

            for (Fragment fragment : view.fragments().values()) {
                assertThat(view.fragments().keySet()).containsAll(fragment.references());
            }
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("fails on a switch mode without item before emitting output")
        void shouldRejectSwitchWithoutItem() {
            SwitchLayout layout =
                    SwitchLayout.create().mode("full", TextPrimitive.of("long")).mode("summary");

            assertThatThrownBy(() -> assembler.assemble(layout))
                    .isInstanceOf(MissingItemException.class)
                    .hasMessageContaining("summary")
                    .extracting(e -> ((AssemblyException) e).getSubject())
                    .isEqualTo("summary");
        }

        @Test
        @DisplayName("fails on a nested incomplete layout")
        void shouldRejectNestedIncompleteLayout() {
            SequenceLayout root = SequenceLayout.of(SwitchLayout.create().mode("only"));

            assertThatThrownBy(() -> assembler.assemble(root))
                    .isInstanceOf(MissingItemException.class);
        }

        @Test
        @DisplayName("rejects a null child naming its slot")
        void shouldRejectNullChild() {
            SequenceLayout root = SequenceLayout.of(TextPrimitive.of("a"), null);

            assertThatThrownBy(() -> assembler.assemble(root))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("slot '1'");
        }

        @Test
        @DisplayName("rejects a null root")
        void shouldRejectNullRoot() {
            assertThatThrownBy(() -> assembler.assemble(null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("rejects plain values with the default resolver")
        void shouldRejectPlainValues() {
            assertThatThrownBy(() -> assembler.assemble(SequenceLayout.of(42)))
                    .isInstanceOf(UnsupportedValueException.class)
                    .hasMessageContaining("java.lang.Integer");
        }

        @Test
        @DisplayName("rejects an id scheme that collides")
        void shouldRejectCollidingIds() {
            ViewAssembler colliding =
                    new ViewAssembler(
                            FragmentId.ROOT,
                            (slot, parent) -> FragmentId.of("same"),
                            RejectingDefaultViewResolver.INSTANCE,
                            true);

            assertThatThrownBy(
                            () ->
                                    colliding.assemble(
                                            SequenceLayout.of(
                                                    TextPrimitive.of("a"), TextPrimitive.of("b"))))
                    .isInstanceOf(AssemblyException.class)
                    .hasMessageContaining("already in use");
        }

        @Test
        @DisplayName("rejects an id scheme that returns the root id")
        void shouldRejectRootCollision() {
            ViewAssembler colliding =
                    new ViewAssembler(
                            FragmentId.ROOT,
                            (slot, parent) -> FragmentId.ROOT,
                            RejectingDefaultViewResolver.INSTANCE,
                            true);

            assertThatThrownBy(() -> colliding.assemble(SequenceLayout.of(TextPrimitive.of("a"))))
                    .isInstanceOf(AssemblyException.class)
                    .extracting(e -> ((AssemblyException) e).getSubject())
                    .isEqualTo("root");
        }
    }

    @Nested
    @DisplayName("custom schemes and resolvers")
    class Extensions {

        @Test
        @DisplayName("uses a custom id scheme and root id")
        void shouldUseCustomScheme() {
            ViewAssembler readable =
                    new ViewAssembler(
                            FragmentId.of("top"),
                            (slot, parent) -> FragmentId.of(parent + "-" + slot),
                            RejectingDefaultViewResolver.INSTANCE,
                            true);

            SequenceLayout nested = SequenceLayout.of(TextPrimitive.of("b"));

            View view = readable.assemble(SequenceLayout.of(TextPrimitive.of("a"), nested));

            assertThat(view.fragments().keySet())
                    .extracting(FragmentId::value)
                    .containsExactlyInAnyOrder("top", "top-0", "top-1", "top-1-0");
        }

        @Test
        @DisplayName("assembles the view supplied by a Viewable")
        void shouldAssembleViewable() {
            Viewable point = () -> TextPrimitive.of("(1, 2)");

            View view = assembler.assemble(SequenceLayout.of(point, point));

            assertThat(view.size()).isEqualTo(2);
            assertThat(view.getFragment(ID_0).orElseThrow().contents())
                    .containsEntry("text", "(1, 2)");
        }

        @Test
        @DisplayName("lets a Viewable reference itself")
        void shouldResolveSelfReferencingViewable() {
            Viewable[] holder = new Viewable[1];
            holder[0] = () -> SequenceLayout.of(TextPrimitive.of("node"), holder[0]);

            View view = assembler.assemble(holder[0]);

            assertThat(view.size()).isEqualTo(2);
            assertThat(view.root().contents())
                    .containsEntry("elements", List.of(ID_0, FragmentId.ROOT));
        }

        @Test
        @DisplayName("delegates plain values to the default-view resolver once per value")
        void shouldDelegateToDefaultViewResolver() {
            String value = "plain";
            when(defaultViewResolver.resolve(value)).thenReturn(TextPrimitive.of(value));
            ViewAssembler withResolver =
                    VizstackFactory.builder().defaultViewResolver(defaultViewResolver).build();

            View view = withResolver.assemble(SequenceLayout.of(value, value));

            assertThat(view.size()).isEqualTo(2);
            assertThat(view.getFragment(ID_0).orElseThrow().contents())
                    .containsEntry("text", "plain");
            verify(defaultViewResolver, times(1)).resolve(value);
        }

        @Test
        @DisplayName("does not consult the resolver for assemblers")
        void shouldBypassResolverForAssemblers() {
            ViewAssembler withResolver =
                    VizstackFactory.builder().defaultViewResolver(defaultViewResolver).build();

            withResolver.assemble(SequenceLayout.of(TextPrimitive.of("a")));

            verify(defaultViewResolver, never()).resolve(any());
        }

        @Test
        @DisplayName("fails when a Viewable returns no assembler")
        void shouldRejectNullView() {
            Viewable broken = () -> null;

            assertThatThrownBy(() -> assembler.assemble(broken))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
