package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Relative emphasis of an icon primitive.
public enum IconEmphasis implements WireValue {
    NORMAL,
    LESS,
    MORE;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
