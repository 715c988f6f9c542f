package io.vizstack.core.fragment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Complete output of one assembly run: the root id and the full fragment table.
///
/// Every fragment id referenced inside any fragment's contents is a key of `fragments`,
/// and every key maps to a resolved fragment. The table keeps the order in which ids were
/// issued, with the root first.
///
/// @implNote Immutable. The fragment table is an unmodifiable copy.
///
/// @param rootId    id of the fragment assembled from the entry object, not null
/// @param fragments fragment table keyed by id, not null, must contain `rootId`
public record View(FragmentId rootId, Map<FragmentId, Fragment> fragments) {

    public View {
        Objects.requireNonNull(rootId, "rootId must not be null");
        Objects.requireNonNull(fragments, "fragments must not be null");
        if (!fragments.containsKey(rootId)) {
            throw new IllegalArgumentException("Root fragment '" + rootId + "' not in fragments");
        }
        fragments = Collections.unmodifiableMap(new LinkedHashMap<>(fragments));
    }

    /// Returns the fragment assembled from the entry object.
    ///
    /// @return root fragment, never null
    public Fragment root() {
        return fragments.get(rootId);
    }

    /// Looks up a fragment by id.
    ///
    /// @param id fragment id, not null
    /// @return the fragment, or empty if the id is not part of this view
    public Optional<Fragment> getFragment(FragmentId id) {
        return Optional.ofNullable(fragments.get(id));
    }

    /// Returns the number of fragments in the table.
    ///
    /// @return fragment count, at least 1
    public int size() {
        return fragments.size();
    }
}
