package io.vizstack.core.assembly.spi;

import io.vizstack.core.fragment.FragmentAssembler;

/// Extension point for viewing values that are neither a
/// {@link FragmentAssembler} nor a {@link io.vizstack.core.fragment.Viewable}.
///
/// Plain values such as strings, numbers or collections reach the assembler when an author
/// puts them directly into a layout. The resolver turns such a value into an assembler that
/// is then assembled like any other node. It is called at most once per distinct value
/// identity in a run.
///
/// ### Registration
/// Pass an instance to {@link io.vizstack.core.VizstackFactory.Builder#defaultViewResolver}:
/// {@snippet :
/// ViewAssembler assembler = VizstackFactory.builder()
///     .defaultViewResolver(value -> TextPrimitive.of(String.valueOf(value)))
///     .build();
/// }
///
/// @implNote Implementations should be stateless and thread-safe.
///
/// @see RejectingDefaultViewResolver for the default implementation
@FunctionalInterface
public interface DefaultViewResolver {

    /// Produces the assembler that represents `value`.
    ///
    /// The returned assembler may reference `value` again, for example through a
    /// {@link io.vizstack.core.fragment.SwitchLayout} with a summary mode. Such a reference
    /// receives the id already assigned to `value`.
    ///
    /// @param value value to view, not null
    /// @return assembler for the value, never null
    /// @throws io.vizstack.core.exception.UnsupportedValueException if the value cannot be viewed
    FragmentAssembler resolve(Object value);
}
