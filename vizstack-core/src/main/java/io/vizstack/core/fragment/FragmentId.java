package io.vizstack.core.fragment;

import java.util.Objects;

/// Opaque identifier of a fragment within one view.
///
/// Exactly one value, the root id, is reserved for the fragment assembled from the object
/// passed to the assembler. All other ids are derived from a parent id and a slot name by a
/// {@link io.vizstack.core.assembly.FragmentIdScheme}. Equality is by value.
///
/// @param value the printable id token, not null or blank
public record FragmentId(String value) implements Comparable<FragmentId> {

    /// Default value of the reserved root id.
    public static final String ROOT_VALUE = "root";

    /// The default reserved root id.
    public static final FragmentId ROOT = new FragmentId(ROOT_VALUE);

    public FragmentId {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("fragment id must not be blank");
        }
    }

    /// Creates a fragment id from its string form.
    ///
    /// @param value the id token, not null or blank
    /// @return fragment id, never null
    public static FragmentId of(String value) {
        return new FragmentId(value);
    }

    @Override
    public int compareTo(FragmentId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
