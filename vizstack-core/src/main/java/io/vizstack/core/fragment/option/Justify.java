package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Justification of a DAG alignment group along its axis.
public enum Justify implements WireValue {
    CENTER,
    NORTH,
    SOUTH,
    EAST,
    WEST;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
