package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Cardinal direction, used for DAG flow direction and port sides.
public enum Direction implements WireValue {
    NORTH,
    SOUTH,
    EAST,
    WEST;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
