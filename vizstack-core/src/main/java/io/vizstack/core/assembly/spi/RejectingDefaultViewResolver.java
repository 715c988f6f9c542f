package io.vizstack.core.assembly.spi;

import io.vizstack.core.exception.UnsupportedValueException;
import io.vizstack.core.fragment.FragmentAssembler;

/// Resolver used when none is configured. Every value is rejected.
public final class RejectingDefaultViewResolver implements DefaultViewResolver {

    public static final RejectingDefaultViewResolver INSTANCE = new RejectingDefaultViewResolver();

    private RejectingDefaultViewResolver() {}

    @Override
    public FragmentAssembler resolve(Object value) {
        String type = value.getClass().getName();
        throw new UnsupportedValueException(
                "No view available for value of type " + type
                        + "; wrap it in a fragment assembler or implement Viewable",
                type);
    }
}
