package io.vizstack.core.fragment;

import java.util.List;
import java.util.Objects;

/// Result of assembling a single fragment kind.
///
/// Any view that contains `fragment` must also contain the fragment of each object in
/// `references`. Order matches the order in which the children were passed to the
/// {@link FragmentIdResolver}; duplicates are allowed.
///
/// @param fragment   the assembled fragment, child references already expressed as ids
/// @param references child objects referenced by the fragment, not null
public record Assembly(Fragment fragment, List<Object> references) {

    public Assembly {
        Objects.requireNonNull(fragment, "fragment must not be null");
        references = List.copyOf(Objects.requireNonNull(references, "references must not be null"));
    }

    /// Creates the assembly of a leaf fragment with no children.
    ///
    /// @param fragment the assembled fragment, not null
    /// @return assembly without references, never null
    public static Assembly leaf(Fragment fragment) {
        return new Assembly(fragment, List.of());
    }
}
