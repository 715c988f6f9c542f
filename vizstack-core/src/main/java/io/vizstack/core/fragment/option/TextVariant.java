package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Rendering variant of a text primitive: plain text or boxed token text.
public enum TextVariant implements WireValue {
    PLAIN,
    TOKEN;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
