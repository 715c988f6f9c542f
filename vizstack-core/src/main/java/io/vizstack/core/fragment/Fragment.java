package io.vizstack.core.fragment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One flattened, serializable record describing a single node of a view.
///
/// `contents` is kind-specific. Any reference to another node is stored as that node's
/// {@link FragmentId}, never as the node itself. Entries without a value are dropped on
/// construction, in nested maps as well, so optional fields are omitted rather than emitted
/// as null. `meta` is an annotation bag copied verbatim from the authoring API and never
/// interpreted by the engine.
///
/// ### Contracts
/// - **Postcondition**: `contents` and `meta` are unmodifiable and keep insertion order
/// - **Invariant**: no map inside `contents` holds a null value
///
/// @param type     the fragment kind, not null
/// @param contents kind-specific content, not null
/// @param meta     free-form annotations, not null
public record Fragment(FragmentType type, Map<String, Object> contents, Map<String, Object> meta) {

    public Fragment {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(contents, "contents must not be null");
        Objects.requireNonNull(meta, "meta must not be null");
        contents = normalizeMap(contents);
        meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /// Creates a fragment without annotations.
    ///
    /// @param type     the fragment kind, not null
    /// @param contents kind-specific content, not null
    /// @return new fragment, never null
    public static Fragment of(FragmentType type, Map<String, Object> contents) {
        return new Fragment(type, contents, Map.of());
    }

    /// Returns every fragment id referenced anywhere in the contents, in encounter order.
    ///
    /// Duplicates are preserved, so a sequence holding the same child twice yields its id twice.
    ///
    /// @return unmodifiable list of referenced ids, never null (empty for primitives)
    public List<FragmentId> references() {
        List<FragmentId> found = new ArrayList<>();
        collectReferences(contents, found);
        return Collections.unmodifiableList(found);
    }

    private static void collectReferences(Object value, List<FragmentId> found) {
        if (value instanceof FragmentId id) {
            found.add(id);
        } else if (value instanceof Map<?, ?> map) {
            for (Object nested : map.values()) {
                collectReferences(nested, found);
            }
        } else if (value instanceof Collection<?> collection) {
            for (Object nested : collection) {
                collectReferences(nested, found);
            }
        }
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> source) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getValue() != null) {
                normalized.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
        }
        return Collections.unmodifiableMap(normalized);
    }

    private static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            return normalizeMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> normalized = new ArrayList<>(collection.size());
            for (Object element : collection) {
                normalized.add(element == null ? null : normalize(element));
            }
            return Collections.unmodifiableList(normalized);
        }
        return value;
    }
}
