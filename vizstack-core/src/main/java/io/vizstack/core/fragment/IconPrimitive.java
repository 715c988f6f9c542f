package io.vizstack.core.fragment;

import io.vizstack.core.fragment.option.IconEmphasis;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A named icon, e.g. `"add_circle"`.
///
/// Contents: `name`, and optionally `emphasis`.
public final class IconPrimitive extends FragmentAssembler {

    private final String name;
    private final IconEmphasis emphasis;

    private IconPrimitive(String name, IconEmphasis emphasis) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.emphasis = emphasis;
    }

    public static IconPrimitive of(String name) {
        return new IconPrimitive(name, null);
    }

    public static IconPrimitive of(String name, IconEmphasis emphasis) {
        return new IconPrimitive(name, emphasis);
    }

    public String getName() {
        return name;
    }

    public IconEmphasis getEmphasis() {
        return emphasis;
    }

    @Override
    public IconPrimitive meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.ICON_PRIMITIVE;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("name", name);
        contents.put("emphasis", wire(emphasis));
        return Assembly.leaf(fragment(contents));
    }
}
