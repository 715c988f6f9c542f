package io.vizstack.core;

import io.vizstack.core.assembly.DigestFragmentIdScheme;
import io.vizstack.core.assembly.FragmentIdScheme;
import io.vizstack.core.assembly.ViewAssembler;
import io.vizstack.core.assembly.spi.DefaultViewResolver;
import io.vizstack.core.assembly.spi.RejectingDefaultViewResolver;
import io.vizstack.core.fragment.FragmentId;
import io.vizstack.core.fragment.View;
import java.util.Objects;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link ViewAssembler} instances.
///
/// Provides static factory methods and a fluent {@link Builder}.
///
/// ### Usage Patterns
///
/// **One-shot assembly with defaults**:
/// {@snippet :
/// View view = VizstackFactory.assemble(SequenceLayout.of(TextPrimitive.of("a")));
/// }
///
/// **Builder with a custom scheme and default-view resolver**:
/// {@snippet :
/// ViewAssembler assembler = VizstackFactory.builder()
///     .config(VizstackConfig.builder().verifyClosure(false).build())
///     .idScheme((slot, parent) -> FragmentId.of(parent + "-" + slot))
///     .defaultViewResolver(value -> TextPrimitive.of(String.valueOf(value)))
///     .build();
/// }
///
/// @see VizstackConfig
/// @see Builder
public final class VizstackFactory {

    private static final Logger logger = Logger.getLogger(VizstackFactory.class.getName());

    private VizstackFactory() {}

    /// Assembles a graph with the default configuration.
    ///
    /// @param root entry node, not null
    /// @return the assembled view, never null
    /// @throws io.vizstack.core.exception.AssemblyException if assembly fails
    public static View assemble(Object root) {
        return createAssembler().assemble(root);
    }

    /// Creates an assembler with the default configuration.
    ///
    /// @return a new assembler, never null
    public static ViewAssembler createAssembler() {
        return createAssembler(new VizstackConfig());
    }

    /// Creates an assembler using the digest scheme described by `config`.
    ///
    /// @param config assembly configuration, not null
    /// @return a new assembler, never null
    /// @throws IllegalArgumentException if the digest algorithm or id length is invalid
    public static ViewAssembler createAssembler(VizstackConfig config) {
        return createAssembler(config, null, null);
    }

    /// Creates an assembler with optional custom collaborators.
    ///
    /// @param config              assembly configuration, not null
    /// @param idScheme            id scheme, may be null for the digest scheme from `config`
    /// @param defaultViewResolver resolver for plain values, may be null to reject them
    /// @return a new assembler, never null
    public static ViewAssembler createAssembler(
            VizstackConfig config,
            FragmentIdScheme idScheme,
            DefaultViewResolver defaultViewResolver) {
        Objects.requireNonNull(config, "config must not be null");
        if (idScheme == null) {
            idScheme =
                    new DigestFragmentIdScheme(config.getDigestAlgorithm(), config.getIdLength());
        }
        if (defaultViewResolver == null) {
            defaultViewResolver = RejectingDefaultViewResolver.INSTANCE;
        }
        logger.fine(
                "Creating view assembler: rootId="
                        + config.getRootId()
                        + ", idScheme="
                        + idScheme.getClass().getSimpleName()
                        + ", verifyClosure="
                        + config.isVerifyClosure());
        return new ViewAssembler(
                FragmentId.of(config.getRootId()),
                idScheme,
                defaultViewResolver,
                config.isVerifyClosure());
    }

    /// Creates a new builder for fluent assembler configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ViewAssembler} instances.
    public static final class Builder {
        private VizstackConfig config = new VizstackConfig();
        private FragmentIdScheme idScheme;
        private DefaultViewResolver defaultViewResolver;

        private Builder() {}

        /// Sets the assembly configuration.
        ///
        /// @param config configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(VizstackConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Replaces the digest scheme with a custom one. `idLength` and `digestAlgorithm` of
        /// the configuration are then ignored.
        ///
        /// @param idScheme id scheme, may be null for the digest scheme
        /// @return this builder for chaining, never null
        public Builder idScheme(FragmentIdScheme idScheme) {
            this.idScheme = idScheme;
            return this;
        }

        /// Sets the resolver for values that are neither assemblers nor viewable.
        ///
        /// @param defaultViewResolver resolver, may be null to reject such values
        /// @return this builder for chaining, never null
        public Builder defaultViewResolver(DefaultViewResolver defaultViewResolver) {
            this.defaultViewResolver = defaultViewResolver;
            return this;
        }

        /// Builds and returns the configured {@link ViewAssembler}.
        ///
        /// @return a new assembler, never null
        public ViewAssembler build() {
            return createAssembler(config, idScheme, defaultViewResolver);
        }
    }
}
