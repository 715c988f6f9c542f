package io.vizstack.core.fragment;

import io.vizstack.core.fragment.option.WireValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Base class for all fragment kinds.
///
/// A fragment assembler is the author-facing node of a visualization graph. Given a
/// {@link FragmentIdResolver}, it produces its own {@link Fragment} together with the child
/// objects that fragment references. Children may be other assemblers, {@link Viewable}
/// objects, or values handled by the configured default-view resolver.
///
/// ### Fragment Kinds
/// - Primitives: {@link TextPrimitive}, {@link TokenPrimitive}, {@link IconPrimitive},
///   {@link ImagePrimitive}
/// - Layouts: {@link FlowLayout}, {@link SequenceLayout}, {@link SwitchLayout},
///   {@link KeyValueLayout}, {@link GridLayout}, {@link DagLayout}
///
/// @implNote Not thread-safe. Layout assemblers are mutable so that graphs with sharing and
/// cycles can be built after construction. Assembly only reads an assembler; it never
/// mutates one.
///
/// @see io.vizstack.core.assembly.ViewAssembler for the traversal that drives assembly
public abstract sealed class FragmentAssembler
        permits TextPrimitive,
                TokenPrimitive,
                IconPrimitive,
                ImagePrimitive,
                FlowLayout,
                SequenceLayout,
                SwitchLayout,
                KeyValueLayout,
                GridLayout,
                DagLayout {

    private final Map<String, Object> meta = new LinkedHashMap<>();

    /// Attaches an annotation copied verbatim into the emitted fragment's `meta`.
    ///
    /// @param key   annotation name, not null
    /// @param value JSON-compatible value, may be null
    /// @return this assembler for chaining
    public FragmentAssembler meta(String key, Object value) {
        meta.put(Objects.requireNonNull(key, "key must not be null"), value);
        return this;
    }

    /// Returns the annotations attached so far.
    ///
    /// @return unmodifiable view of the annotations, never null
    public Map<String, Object> getMeta() {
        return Collections.unmodifiableMap(meta);
    }

    /// Returns the kind of fragment this assembler produces.
    ///
    /// @return fragment type, never null
    public abstract FragmentType getFragmentType();

    /// Produces this node's fragment and the list of children it references.
    ///
    /// Child references in the returned contents must be ids obtained from `resolver`.
    /// Every child passed to `resolver` must also appear in the returned references.
    ///
    /// @param resolver callback mapping child objects to fragment ids, not null
    /// @return assembled fragment and referenced children, never null
    /// @throws io.vizstack.core.exception.AssemblyException if the assembler is incomplete
    public abstract Assembly assemble(FragmentIdResolver resolver);

    protected final Fragment fragment(Map<String, Object> contents) {
        return new Fragment(getFragmentType(), contents, meta);
    }

    protected static String wire(WireValue value) {
        return value != null ? value.wireName() : null;
    }
}
