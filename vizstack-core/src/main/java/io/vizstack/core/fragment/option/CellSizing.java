package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Row height or column width policy of a grid layout.
public enum CellSizing implements WireValue {
    FIT,
    EQUAL;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
