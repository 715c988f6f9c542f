package io.vizstack.core.fragment;

import io.vizstack.core.fragment.option.TokenColor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A boxed piece of text on a colored background.
///
/// Contents: `text`, and optionally `color`.
public final class TokenPrimitive extends FragmentAssembler {

    private final String text;
    private final TokenColor color;

    private TokenPrimitive(String text, TokenColor color) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.color = color;
    }

    public static TokenPrimitive of(String text) {
        return new TokenPrimitive(text, null);
    }

    public static TokenPrimitive of(String text, TokenColor color) {
        return new TokenPrimitive(text, color);
    }

    public String getText() {
        return text;
    }

    public TokenColor getColor() {
        return color;
    }

    @Override
    public TokenPrimitive meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.TOKEN_PRIMITIVE;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("text", text);
        contents.put("color", wire(color));
        return Assembly.leaf(fragment(contents));
    }
}
