package io.vizstack.core.fragment;

import io.vizstack.core.fragment.option.Direction;
import io.vizstack.core.fragment.option.IconEmphasis;
import io.vizstack.core.fragment.option.TextColor;
import io.vizstack.core.fragment.option.TextVariant;
import io.vizstack.core.fragment.option.TokenColor;
import java.util.List;
import java.util.Map;

/// Static entry point for building visualization graphs.
///
/// Each method delegates to the corresponding kind's factory, so a graph can be written with
/// a single static import:
///
/// {@snippet :
/// import static io.vizstack.core.fragment.Fragments.*;
///
/// FragmentAssembler view = sequence(text("a"), token("b", TokenColor.BLUE), icon("add"));
/// }
public final class Fragments {

    private Fragments() {}

    public static TextPrimitive text(String text) {
        return TextPrimitive.of(text);
    }

    public static TextPrimitive text(String text, TextColor color, TextVariant variant) {
        return TextPrimitive.of(text, color, variant);
    }

    public static TokenPrimitive token(String text) {
        return TokenPrimitive.of(text);
    }

    public static TokenPrimitive token(String text, TokenColor color) {
        return TokenPrimitive.of(text, color);
    }

    public static IconPrimitive icon(String name) {
        return IconPrimitive.of(name);
    }

    public static IconPrimitive icon(String name, IconEmphasis emphasis) {
        return IconPrimitive.of(name, emphasis);
    }

    public static ImagePrimitive image(String filePath) {
        return ImagePrimitive.of(filePath);
    }

    public static FlowLayout flow(Object... elements) {
        return FlowLayout.of(elements);
    }

    public static SequenceLayout sequence(Object... elements) {
        return SequenceLayout.of(elements);
    }

    public static SequenceLayout sequence(List<?> elements) {
        return SequenceLayout.of(elements);
    }

    public static SwitchLayout switchOf(List<String> modes, Map<String, ?> items) {
        return SwitchLayout.of(modes, items);
    }

    public static KeyValueLayout keyValue(Map<?, ?> entries) {
        return KeyValueLayout.of(entries);
    }

    /// Creates a grid from a grid layout string such as `"ABB\nACC"`.
    ///
    /// @param spec grid specification, not null
    /// @return new grid layout, never null
    /// @throws io.vizstack.core.exception.MalformedGridSpecException if `spec` is malformed
    public static GridLayout grid(String spec) {
        return GridLayout.of(spec);
    }

    public static DagLayout dag() {
        return DagLayout.create();
    }

    public static DagLayout dag(Direction flowDirection) {
        return DagLayout.create(flowDirection);
    }
}
