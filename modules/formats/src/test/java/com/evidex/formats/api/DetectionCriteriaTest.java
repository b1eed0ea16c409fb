package com.evidex.formats.api;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DetectionCriteriaTest {

    @Test
    void shouldMatchMagicBytesAtOffsetZero() {
        byte[] zipMagic = {0x50, 0x4B, 0x03, 0x04};
        var criteria = new DetectionCriteria(
                Set.of("application/zip"), Set.of("zip"), zipMagic, 0, 200);

        byte[] header = {0x50, 0x4B, 0x03, 0x04, 0x00, 0x00};
        assertThat(criteria.matches(null, null, header)).isTrue();
        assertThat(criteria.matchesSignature(null, header)).isTrue();
    }

    @Test
    void shouldMatchMagicBytesAtOffset257() {
        byte[] tarMagic = {'u', 's', 't', 'a', 'r'};
        var criteria = new DetectionCriteria(
                Set.of("application/x-tar"), Set.of("tar"), tarMagic, 257, 200);

        byte[] header = new byte[512];
        System.arraycopy(tarMagic, 0, header, 257, tarMagic.length);

        assertThat(criteria.matches(null, null, header)).isTrue();
    }

    @Test
    void shouldNotMatchMagicIfHeaderTooShort() {
        byte[] tarMagic = {'u', 's', 't', 'a', 'r'};
        var criteria = new DetectionCriteria(
                Set.of("application/x-tar"), Set.of("tar"), tarMagic, 257, 200);

        assertThat(criteria.matches(null, null, new byte[100])).isFalse();
    }

    @Test
    void shouldMatchMimeTypeAndWildcard() {
        var exact = new DetectionCriteria(Set.of("application/zip"), Set.of(), null, 0, 100);
        var wildcard = new DetectionCriteria(Set.of("application/*"), Set.of(), null, 0, 100);

        assertThat(exact.matchesSignature("application/zip", new byte[0])).isTrue();
        assertThat(wildcard.matchesSignature("application/x-tar", new byte[0])).isTrue();
        assertThat(exact.matchesSignature("text/plain", new byte[0])).isFalse();
    }

    @Test
    void extensionMatchIsCaseInsensitiveAndIgnoredBySignatureCheck() {
        var criteria = new DetectionCriteria(Set.of("application/zip"), Set.of("ufdr"), null, 0, 200);

        assertThat(criteria.matches(null, "Phone.UFDR", new byte[0])).isTrue();
        assertThat(criteria.matchesSignature(null, new byte[0])).isFalse();
        assertThat(criteria.matchesExtension("ufdr")).isFalse();
    }

    @Test
    void shouldNotMatchUnrelatedFile() {
        var criteria = new DetectionCriteria(
                Set.of("application/zip"), Set.of("zip"),
                new byte[]{0x50, 0x4B, 0x03, 0x04}, 0, 200);

        assertThat(criteria.matches("text/plain", "file.txt", "Hello".getBytes())).isFalse();
    }

    @Test
    void shouldDefensiveCopyMagicBytes() {
        byte[] magic = {0x1f, (byte) 0x8b};
        var criteria = new DetectionCriteria(Set.of(), Set.of(), magic, 0, 0);
        magic[0] = 0;

        assertThat(criteria.magicBytes()[0]).isEqualTo((byte) 0x1f);
    }
}
