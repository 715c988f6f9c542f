package io.vizstack.core.fragment;

import io.vizstack.core.fragment.option.TextColor;
import io.vizstack.core.fragment.option.TextVariant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A contiguous block of text.
///
/// Contents: `text`, and optionally `color` and `variant`.
public final class TextPrimitive extends FragmentAssembler {

    private final String text;
    private final TextColor color;
    private final TextVariant variant;

    private TextPrimitive(String text, TextColor color, TextVariant variant) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.color = color;
        this.variant = variant;
    }

    /// Creates plain text with renderer defaults.
    ///
    /// @param text the text to render, not null
    /// @return new text primitive, never null
    public static TextPrimitive of(String text) {
        return new TextPrimitive(text, null, null);
    }

    /// Creates text with an explicit color and variant.
    ///
    /// @param text    the text to render, not null
    /// @param color   text color, may be null for the renderer default
    /// @param variant text variant, may be null for the renderer default
    /// @return new text primitive, never null
    public static TextPrimitive of(String text, TextColor color, TextVariant variant) {
        return new TextPrimitive(text, color, variant);
    }

    public String getText() {
        return text;
    }

    public TextColor getColor() {
        return color;
    }

    public TextVariant getVariant() {
        return variant;
    }

    @Override
    public TextPrimitive meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.TEXT_PRIMITIVE;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("text", text);
        contents.put("color", wire(color));
        contents.put("variant", wire(variant));
        return Assembly.leaf(fragment(contents));
    }

    @Override
    public String toString() {
        return "TextPrimitive{text='" + text + "'}";
    }
}
