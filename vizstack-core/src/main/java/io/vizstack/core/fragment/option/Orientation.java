package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Axis along which a sequence layout arranges its elements.
public enum Orientation implements WireValue {
    HORIZONTAL,
    VERTICAL;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
