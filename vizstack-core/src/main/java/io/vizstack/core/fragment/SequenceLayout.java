package io.vizstack.core.fragment;

import io.vizstack.core.fragment.option.Orientation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Arranges its elements in a straight line, like a list.
///
/// Contents: `elements` (ids in insertion order, duplicates preserved positionally), and
/// optionally `orientation`, `startMotif`, `endMotif` and `showLabels`. Element `i` is
/// resolved under slot `"i"`.
///
/// A sequence may contain itself. The element then resolves to the sequence's own id and no
/// second fragment is emitted.
///
/// {@snippet :
/// SequenceLayout list = SequenceLayout.of(TextPrimitive.of("hello"), TextPrimitive.of("there"))
///         .orientation(Orientation.VERTICAL)
///         .startMotif("[")
///         .endMotif("]");
/// }
public final class SequenceLayout extends FragmentAssembler {

    private final List<Object> elements = new ArrayList<>();
    private Orientation orientation;
    private String startMotif;
    private String endMotif;
    private Boolean showLabels;

    private SequenceLayout() {}

    /// Creates an empty sequence.
    ///
    /// @return new sequence layout, never null
    public static SequenceLayout create() {
        return new SequenceLayout();
    }

    /// Creates a sequence holding the given elements.
    ///
    /// @param elements initial elements, in display order
    /// @return new sequence layout, never null
    public static SequenceLayout of(Object... elements) {
        return new SequenceLayout().items(elements);
    }

    /// Creates a sequence holding the elements of a list.
    ///
    /// @param elements initial elements, in display order, not null
    /// @return new sequence layout, never null
    public static SequenceLayout of(List<?> elements) {
        SequenceLayout sequence = new SequenceLayout();
        sequence.elements.addAll(elements);
        return sequence;
    }

    public SequenceLayout item(Object item) {
        elements.add(item);
        return this;
    }

    public SequenceLayout items(Object... items) {
        elements.addAll(Arrays.asList(items));
        return this;
    }

    /// Sets the layout axis.
    ///
    /// @param orientation horizontal or vertical, null for the renderer default
    /// @return this layout for chaining
    public SequenceLayout orientation(Orientation orientation) {
        this.orientation = orientation;
        return this;
    }

    /// Sets the string shown before the first element, e.g. `"["`.
    ///
    /// @param startMotif opening motif, may be null
    /// @return this layout for chaining
    public SequenceLayout startMotif(String startMotif) {
        this.startMotif = startMotif;
        return this;
    }

    /// Sets the string shown after the last element, e.g. `"]"`.
    ///
    /// @param endMotif closing motif, may be null
    /// @return this layout for chaining
    public SequenceLayout endMotif(String endMotif) {
        this.endMotif = endMotif;
        return this;
    }

    public SequenceLayout showLabels(Boolean showLabels) {
        this.showLabels = showLabels;
        return this;
    }

    public List<Object> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public String getStartMotif() {
        return startMotif;
    }

    public String getEndMotif() {
        return endMotif;
    }

    public Boolean getShowLabels() {
        return showLabels;
    }

    @Override
    public SequenceLayout meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.SEQUENCE_LAYOUT;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        List<FragmentId> ids = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            ids.add(resolver.getId(elements.get(i), Integer.toString(i)));
        }
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("elements", ids);
        contents.put("orientation", wire(orientation));
        contents.put("startMotif", startMotif);
        contents.put("endMotif", endMotif);
        contents.put("showLabels", showLabels);
        return new Assembly(fragment(contents), elements);
    }
}
