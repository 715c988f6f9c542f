package io.vizstack.core.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.vizstack.core.fragment.FragmentId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DigestFragmentIdScheme")
class DigestFragmentIdSchemeTest {

    private final DigestFragmentIdScheme scheme = new DigestFragmentIdScheme();

    @Test
    @DisplayName("hashes parent and slot into a short URL-safe id")
    void shouldProduceKnownIds() {
        assertThat(scheme.newId("0", FragmentId.ROOT)).isEqualTo(FragmentId.of("OZb3FBqdia"));
        assertThat(scheme.newId("1", FragmentId.ROOT)).isEqualTo(FragmentId.of("iFFzkzVSDF"));
        assertThat(scheme.newId("nA", FragmentId.ROOT)).isEqualTo(FragmentId.of("-ezUttLwaR"));
        assertThat(scheme.newId("0", FragmentId.of("OZb3FBqdia")))
                .isEqualTo(FragmentId.of("zW0rfVDNID"));
    }

    @Test
    @DisplayName("returns the same id for the same input")
    void shouldBeDeterministic() {
        FragmentId first = scheme.newId("summary", FragmentId.ROOT);
        FragmentId second = new DigestFragmentIdScheme().newId("summary", FragmentId.ROOT);

        assertThat(first).isEqualTo(second).isEqualTo(FragmentId.of("VCS0BM7kHM"));
    }

    @Test
    @DisplayName("distinguishes slots and parents")
    void shouldDistinguishInputs() {
        FragmentId a = scheme.newId("0", FragmentId.ROOT);
        FragmentId b = scheme.newId("1", FragmentId.ROOT);
        FragmentId c = scheme.newId("0", a);

        assertThat(a).isNotEqualTo(b).isNotEqualTo(c);
        assertThat(b).isNotEqualTo(c);
    }

    @Test
    @DisplayName("never produces padding or URL-unsafe characters")
    void shouldUseUrlSafeAlphabet() {
        for (int i = 0; i < 200; i++) {
            assertThat(scheme.newId(Integer.toString(i), FragmentId.ROOT).value())
                    .hasSize(10)
                    .matches("[A-Za-z0-9_-]+");
        }
    }

    @Test
    @DisplayName("honours a custom algorithm and length")
    void shouldSupportCustomDigest() {
        DigestFragmentIdScheme sha = new DigestFragmentIdScheme("SHA-256", 43);

        assertThat(sha.newId("0", FragmentId.ROOT).value()).hasSize(43);
        assertThat(sha.getAlgorithm()).isEqualTo("SHA-256");
    }

    @Test
    @DisplayName("keeps a prefix of the full digest when shortened")
    void shouldTruncate() {
        FragmentId shortId = new DigestFragmentIdScheme("MD5", 4).newId("0", FragmentId.ROOT);

        assertThat(shortId.value()).isEqualTo("OZb3");
    }

    @Test
    @DisplayName("rejects lengths outside the encoded digest")
    void shouldRejectInvalidLength() {
        assertThatThrownBy(() -> new DigestFragmentIdScheme("MD5", 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DigestFragmentIdScheme("MD5", 23))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("22");
    }

    @Test
    @DisplayName("rejects unknown algorithms")
    void shouldRejectUnknownAlgorithm() {
        assertThatThrownBy(() -> new DigestFragmentIdScheme("NOPE-1", 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NOPE-1");
    }
}
