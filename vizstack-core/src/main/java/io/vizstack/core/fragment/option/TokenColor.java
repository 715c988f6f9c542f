package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Background color of a token primitive.
public enum TokenColor implements WireValue {
    GRAY,
    BROWN,
    PURPLE,
    BLUE,
    GREEN,
    YELLOW,
    ORANGE,
    RED,
    PINK;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
