package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Foreground color of a text primitive.
public enum TextColor implements WireValue {
    DEFAULT,
    PRIMARY,
    SECONDARY,
    ERROR,
    INVISIBLE;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
