package io.vizstack.core.fragment.option;

import java.util.Locale;

/// Axis on which the nodes of a DAG alignment group are lined up.
public enum AlignmentAxis implements WireValue {
    X,
    Y;

    @Override
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
