package io.vizstack.core.assembly;

import io.vizstack.core.fragment.FragmentId;

/// Derives the id of a newly discovered child from its parent's id and the slot under which
/// the parent references it.
///
/// ### Contracts
/// - **Determinism**: the same `(slot, parentId)` always yields the same id
/// - **Postcondition**: never returns the reserved root id of the run
///
/// Distinct `(slot, parentId)` pairs should yield distinct ids. {@link ViewAssembler} rejects a
/// collision between two different nodes instead of merging them.
///
/// @see DigestFragmentIdScheme for the default implementation
@FunctionalInterface
public interface FragmentIdScheme {

    /// Mints the id of a child node.
    ///
    /// @param slot     name under which the parent references the child, not null
    /// @param parentId id of the referencing node, not null
    /// @return id of the child, never null
    FragmentId newId(String slot, FragmentId parentId);
}
