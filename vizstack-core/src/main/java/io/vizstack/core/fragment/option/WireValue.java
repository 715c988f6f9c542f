package io.vizstack.core.fragment.option;

/// A closed option whose value is written to fragment contents as a lowercase string.
public interface WireValue {

    /// Returns the string written to the fragment contents for this option.
    ///
    /// @return wire representation, never null
    String wireName();
}
