package io.vizstack.core.fragment;

import io.vizstack.core.exception.MissingItemException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Shows one of several alternative items at a time, cycling through named modes.
///
/// Contents: `modes`, the ids of the mode items in mode order, and optionally `showLabels`.
/// The item of mode `i` is resolved under slot `"i"`.
///
/// Modes and items are declared independently; every declared mode must have an item by the
/// time the switch is assembled, otherwise assembly fails with {@link MissingItemException}
/// before any child id is issued.
public final class SwitchLayout extends FragmentAssembler {

    private final List<String> modes = new ArrayList<>();
    private final Map<String, Object> items = new LinkedHashMap<>();
    private Boolean showLabels;

    private SwitchLayout() {}

    /// Creates a switch with no modes.
    ///
    /// @return new switch layout, never null
    public static SwitchLayout create() {
        return new SwitchLayout();
    }

    /// Creates a switch with the given mode order and mode items.
    ///
    /// @param modes mode names in cycling order, not null
    /// @param items items keyed by mode name, not null (may be incomplete until assembly)
    /// @return new switch layout, never null
    public static SwitchLayout of(List<String> modes, Map<String, ?> items) {
        SwitchLayout layout = new SwitchLayout();
        modes.forEach(layout::mode);
        items.forEach(layout::item);
        return layout;
    }

    /// Appends a mode whose item is supplied later with {@link #item(String, Object)}.
    ///
    /// @param name mode name, not null
    /// @return this layout for chaining
    public SwitchLayout mode(String name) {
        modes.add(Objects.requireNonNull(name, "mode name must not be null"));
        return this;
    }

    /// Appends a mode together with its item.
    ///
    /// @param name mode name, not null
    /// @param item content shown in this mode, not null
    /// @return this layout for chaining
    public SwitchLayout mode(String name, Object item) {
        return mode(name).item(name, item);
    }

    /// Sets or replaces the item of a mode.
    ///
    /// @param name mode name, not null
    /// @param item content shown in this mode, not null
    /// @return this layout for chaining
    public SwitchLayout item(String name, Object item) {
        items.put(Objects.requireNonNull(name, "mode name must not be null"), item);
        return this;
    }

    public SwitchLayout showLabels(Boolean showLabels) {
        this.showLabels = showLabels;
        return this;
    }

    public List<String> getModes() {
        return Collections.unmodifiableList(modes);
    }

    @Override
    public SwitchLayout meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.SWITCH_LAYOUT;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        for (String mode : modes) {
            if (!items.containsKey(mode)) {
                throw new MissingItemException(
                        "No item was provided for mode '" + mode + "'", mode);
            }
        }
        List<FragmentId> ids = new ArrayList<>(modes.size());
        List<Object> references = new ArrayList<>(modes.size());
        for (int i = 0; i < modes.size(); i++) {
            Object item = items.get(modes.get(i));
            ids.add(resolver.getId(item, Integer.toString(i)));
            references.add(item);
        }
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("modes", ids);
        contents.put("showLabels", showLabels);
        return new Assembly(fragment(contents), references);
    }
}
