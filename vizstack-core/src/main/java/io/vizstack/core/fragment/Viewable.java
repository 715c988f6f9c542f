package io.vizstack.core.fragment;

/// Implemented by domain objects that know how to visualize themselves.
///
/// When a viewable object is reached during assembly, its {@link #view()} is called once and
/// the returned assembler produces the object's fragment. The object itself, not the returned
/// assembler, is what identifies the node, so two references to the same viewable share one
/// fragment.
///
/// {@snippet :
/// record Point(int x, int y) implements Viewable {
///     public FragmentAssembler view() {
///         return KeyValueLayout.create().item(TextPrimitive.of("x"), TextPrimitive.of("" + x))
///                 .item(TextPrimitive.of("y"), TextPrimitive.of("" + y));
///     }
/// }
/// }
@FunctionalInterface
public interface Viewable {

    /// Returns an assembler describing this object.
    ///
    /// @return assembler for this object, never null
    FragmentAssembler view();
}
