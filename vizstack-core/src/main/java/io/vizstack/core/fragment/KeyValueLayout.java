package io.vizstack.core.fragment;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Shows an ordered sequence of key-value pairs.
///
/// Contents: `entries`, an ordered array of `{key, value}` id pairs, and optionally
/// `separator`, `startMotif`, `endMotif`, `alignSeparators` and `showLabels`. Entries are
/// kept as an array rather than a map so that keys may themselves be composite fragments.
/// The key and value of entry `i` are resolved under slots `"ik"` and `"iv"`.
public final class KeyValueLayout extends FragmentAssembler {

    private final List<Map.Entry<Object, Object>> entries = new ArrayList<>();
    private String separator;
    private String startMotif;
    private String endMotif;
    private Boolean alignSeparators;
    private Boolean showLabels;

    private KeyValueLayout() {}

    public static KeyValueLayout create() {
        return new KeyValueLayout();
    }

    /// Creates a layout holding the entries of a map, in its iteration order.
    ///
    /// @param entries key-value pairs, not null
    /// @return new key-value layout, never null
    public static KeyValueLayout of(Map<?, ?> entries) {
        KeyValueLayout layout = new KeyValueLayout();
        entries.forEach(layout::item);
        return layout;
    }

    /// Appends one entry.
    ///
    /// @param key   object shown as the key, not null
    /// @param value object shown as the value, not null
    /// @return this layout for chaining
    public KeyValueLayout item(Object key, Object value) {
        entries.add(new AbstractMap.SimpleImmutableEntry<>(key, value));
        return this;
    }

    /// Sets the string shown between each key and its value, e.g. `":"`.
    ///
    /// @param separator separator, may be null
    /// @return this layout for chaining
    public KeyValueLayout separator(String separator) {
        this.separator = separator;
        return this;
    }

    public KeyValueLayout startMotif(String startMotif) {
        this.startMotif = startMotif;
        return this;
    }

    public KeyValueLayout endMotif(String endMotif) {
        this.endMotif = endMotif;
        return this;
    }

    public KeyValueLayout alignSeparators(Boolean alignSeparators) {
        this.alignSeparators = alignSeparators;
        return this;
    }

    public KeyValueLayout showLabels(Boolean showLabels) {
        this.showLabels = showLabels;
        return this;
    }

    public List<Map.Entry<Object, Object>> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public KeyValueLayout meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.KEY_VALUE_LAYOUT;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        List<Map<String, Object>> pairs = new ArrayList<>(entries.size());
        List<Object> references = new ArrayList<>(entries.size() * 2);
        for (int i = 0; i < entries.size(); i++) {
            Map.Entry<Object, Object> entry = entries.get(i);
            Map<String, Object> pair = new LinkedHashMap<>();
            pair.put("key", resolver.getId(entry.getKey(), i + "k"));
            pair.put("value", resolver.getId(entry.getValue(), i + "v"));
            pairs.add(pair);
            references.add(entry.getKey());
            references.add(entry.getValue());
        }
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("entries", pairs);
        contents.put("separator", separator);
        contents.put("startMotif", startMotif);
        contents.put("endMotif", endMotif);
        contents.put("alignSeparators", alignSeparators);
        contents.put("showLabels", showLabels);
        return new Assembly(fragment(contents), references);
    }
}
