package io.vizstack.core;

import io.vizstack.core.assembly.DigestFragmentIdScheme;
import io.vizstack.core.fragment.FragmentId;

/// Configuration options for view assembly.
///
/// Controls the reserved root id, the default identifier scheme and the final closure check.
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `rootId`: `"root"`
/// - `idLength`: `10` (characters kept from the encoded digest)
/// - `digestAlgorithm`: `"MD5"`
/// - `verifyClosure`: `true`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link VizstackFactory}. Do not modify after the assembler
/// is created.
///
/// @see VizstackFactory#createAssembler(VizstackConfig)
/// @see Builder
public class VizstackConfig {
    private String rootId = FragmentId.ROOT_VALUE;
    private int idLength = DigestFragmentIdScheme.DEFAULT_ID_LENGTH;
    private String digestAlgorithm = DigestFragmentIdScheme.DEFAULT_ALGORITHM;
    private boolean verifyClosure = true;

    /// Creates a configuration with default values.
    public VizstackConfig() {}

    /// Returns the id given to the entry node of every view.
    ///
    /// @return root id, never null
    public String getRootId() {
        return rootId;
    }

    /// Sets the id given to the entry node of every view.
    ///
    /// @param rootId non-blank id, not null
    public void setRootId(String rootId) {
        this.rootId = rootId;
    }

    /// Returns the number of characters kept from each encoded digest.
    ///
    /// @return id length
    public int getIdLength() {
        return idLength;
    }

    /// Sets the number of characters kept from each encoded digest.
    ///
    /// ### Contracts
    /// - **Precondition**: between 1 and the encoded length of the configured digest
    ///
    /// @param idLength id length
    public void setIdLength(int idLength) {
        this.idLength = idLength;
    }

    public String getDigestAlgorithm() {
        return digestAlgorithm;
    }

    /// Sets the {@link java.security.MessageDigest} algorithm used by the default scheme.
    ///
    /// @param digestAlgorithm algorithm name such as `"MD5"` or `"SHA-256"`, not null
    public void setDigestAlgorithm(String digestAlgorithm) {
        this.digestAlgorithm = digestAlgorithm;
    }

    /// Returns whether every emitted reference is checked against the fragment table.
    ///
    /// @return `true` if the closure check runs after each assembly
    public boolean isVerifyClosure() {
        return verifyClosure;
    }

    public void setVerifyClosure(boolean verifyClosure) {
        this.verifyClosure = verifyClosure;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link VizstackConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final VizstackConfig config = new VizstackConfig();

        /// Sets the id given to the entry node of every view.
        ///
        /// @param rootId non-blank id, not null
        /// @return this builder for chaining, never null
        public Builder rootId(String rootId) {
            config.rootId = rootId;
            return this;
        }

        public Builder idLength(int idLength) {
            config.idLength = idLength;
            return this;
        }

        public Builder digestAlgorithm(String digestAlgorithm) {
            config.digestAlgorithm = digestAlgorithm;
            return this;
        }

        /// Enables or disables the closure check after each assembly.
        ///
        /// @param verifyClosure `true` to check every emitted reference
        /// @return this builder for chaining, never null
        public Builder verifyClosure(boolean verifyClosure) {
            config.verifyClosure = verifyClosure;
            return this;
        }

        /// Builds and returns the configured {@link VizstackConfig} instance.
        ///
        /// @return the configured instance, never null
        public VizstackConfig build() {
            return config;
        }
    }
}
