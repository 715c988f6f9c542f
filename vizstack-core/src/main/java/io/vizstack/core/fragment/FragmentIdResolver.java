package io.vizstack.core.fragment;

/// Callback handed to a fragment kind during assembly to turn child objects into ids.
///
/// The first time a child object is seen, a fresh id is derived from the parent's id and
/// `slot` and the child is scheduled for assembly. Later calls with the same instance return
/// the id it was first given, whatever slot is passed. Identity, not equality, decides
/// whether two children are the same.
@FunctionalInterface
public interface FragmentIdResolver {

    /// Returns the fragment id to embed in place of `child`.
    ///
    /// @param child the referenced object, not null
    /// @param slot  name unique among the parent's children, not null
    /// @return id of the child's fragment, never null
    FragmentId getId(Object child, String slot);
}
