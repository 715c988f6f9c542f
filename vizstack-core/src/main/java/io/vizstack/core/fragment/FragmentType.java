package io.vizstack.core.fragment;

import java.util.Objects;

/// Closed set of fragment kinds, each with the tag written to the `type` field of a fragment.
///
/// ```
/// Tag              Category    Child references in contents
/// ────────────────┼───────────┼──────────────────────────────────────────
/// TextPrimitive   │ primitive │ none
/// TokenPrimitive  │ primitive │ none
/// IconPrimitive   │ primitive │ none
/// ImagePrimitive  │ primitive │ none
/// FlowLayout      │ layout    │ elements[]
/// SequenceLayout  │ layout    │ elements[]
/// SwitchLayout    │ layout    │ modes[]
/// KeyValueLayout  │ layout    │ entries[].key, entries[].value
/// GridLayout      │ layout    │ cells{}.fragmentId
/// DagLayout       │ layout    │ nodes{}.fragmentId
/// ```
public enum FragmentType {
    TEXT_PRIMITIVE("TextPrimitive", false),
    TOKEN_PRIMITIVE("TokenPrimitive", false),
    ICON_PRIMITIVE("IconPrimitive", false),
    IMAGE_PRIMITIVE("ImagePrimitive", false),
    FLOW_LAYOUT("FlowLayout", true),
    SEQUENCE_LAYOUT("SequenceLayout", true),
    SWITCH_LAYOUT("SwitchLayout", true),
    KEY_VALUE_LAYOUT("KeyValueLayout", true),
    GRID_LAYOUT("GridLayout", true),
    DAG_LAYOUT("DagLayout", true);

    private final String wireName;
    private final boolean layout;

    FragmentType(String wireName, boolean layout) {
        this.wireName = wireName;
        this.layout = layout;
    }

    /// Returns the tag written to the `type` field.
    ///
    /// @return wire tag, never null
    public String wireName() {
        return wireName;
    }

    /// Returns whether fragments of this kind may reference child fragments.
    ///
    /// @return true for layouts, false for primitives
    public boolean isLayout() {
        return layout;
    }

    /// Looks up a fragment type by its wire tag.
    ///
    /// @param wireName tag as found in the `type` field, not null
    /// @return matching fragment type, never null
    /// @throws IllegalArgumentException if no fragment type has the given tag
    public static FragmentType fromWireName(String wireName) {
        Objects.requireNonNull(wireName, "wireName must not be null");
        for (FragmentType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown fragment type: " + wireName);
    }
}
