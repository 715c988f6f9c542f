package io.vizstack.core.assembly;

import io.vizstack.core.fragment.FragmentId;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;

/// Default {@link FragmentIdScheme}: a truncated digest of `parentId + "-" + slot`.
///
/// The digest of the UTF-8 bytes is encoded as URL-safe Base64 without padding and cut to
/// `idLength` characters. With the defaults (MD5, 10 characters) the child of `root` in
/// slot `0` is `OZb3FBqdia`.
///
/// @implNote Stateless and thread-safe. A new {@link MessageDigest} is obtained per call.
public final class DigestFragmentIdScheme implements FragmentIdScheme {

    public static final String DEFAULT_ALGORITHM = "MD5";
    public static final int DEFAULT_ID_LENGTH = 10;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final String algorithm;
    private final int idLength;

    /// Creates a scheme with the default algorithm and id length.
    public DigestFragmentIdScheme() {
        this(DEFAULT_ALGORITHM, DEFAULT_ID_LENGTH);
    }

    /// Creates a scheme with a custom digest.
    ///
    /// @param algorithm name of a {@link MessageDigest} algorithm, not null
    /// @param idLength  number of encoded characters kept, between 1 and the encoded digest length
    /// @throws IllegalArgumentException if the algorithm is unavailable or `idLength` is out of
    ///     range
    public DigestFragmentIdScheme(String algorithm, int idLength) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        int encodedLength = ENCODER.encodeToString(new byte[digest().getDigestLength()]).length();
        if (idLength < 1 || idLength > encodedLength) {
            throw new IllegalArgumentException(
                    "Id length must be between 1 and "
                            + encodedLength
                            + " for "
                            + algorithm
                            + ", got "
                            + idLength);
        }
        this.idLength = idLength;
    }

    @Override
    public FragmentId newId(String slot, FragmentId parentId) {
        String input = parentId.value() + "-" + slot;
        byte[] hash = digest().digest(input.getBytes(StandardCharsets.UTF_8));
        return FragmentId.of(ENCODER.encodeToString(hash).substring(0, idLength));
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public int getIdLength() {
        return idLength;
    }

    private MessageDigest digest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Digest algorithm not available: " + algorithm, e);
        }
    }
}
