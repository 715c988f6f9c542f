package io.vizstack.core.fragment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Arranges its elements inline, one after another, like words in a paragraph.
///
/// Contents: `elements`, the ids of the elements in insertion order. Element `i` is
/// resolved under slot `"i"`.
public final class FlowLayout extends FragmentAssembler {

    private final List<Object> elements = new ArrayList<>();

    private FlowLayout() {}

    /// Creates a flow layout holding the given elements.
    ///
    /// @param elements initial elements, in display order
    /// @return new flow layout, never null
    public static FlowLayout of(Object... elements) {
        return new FlowLayout().items(elements);
    }

    /// Appends one element.
    ///
    /// @param item element to append, not null
    /// @return this layout for chaining
    public FlowLayout item(Object item) {
        elements.add(item);
        return this;
    }

    /// Appends several elements in order.
    ///
    /// @param items elements to append
    /// @return this layout for chaining
    public FlowLayout items(Object... items) {
        elements.addAll(Arrays.asList(items));
        return this;
    }

    public List<Object> getElements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public FlowLayout meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.FLOW_LAYOUT;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        List<FragmentId> ids = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            ids.add(resolver.getId(elements.get(i), Integer.toString(i)));
        }
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("elements", ids);
        return new Assembly(fragment(contents), elements);
    }
}
