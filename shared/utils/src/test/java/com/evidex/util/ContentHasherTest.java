package com.evidex.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHasherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldMatchKnownSha256OfAbc() {
        ContentHash hash = ContentHasher.hash("abc".getBytes(StandardCharsets.US_ASCII));

        assertThat(hash.toHex())
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void streamAndByteArrayAgreeAcrossChunkBoundary() throws Exception {
        byte[] data = new byte[40 * 1024 + 7];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i * 31);
        }

        ContentHash fromStream = ContentHasher.hash(new ByteArrayInputStream(data));

        assertThat(fromStream).isEqualTo(ContentHasher.hash(data));
    }

    @Test
    void shouldHashFileOnDisk() throws Exception {
        Path file = tempDir.resolve("evidence.txt");
        Files.writeString(file, "abc");

        assertThat(ContentHasher.hash(file)).isEqualTo(ContentHasher.hash("abc".getBytes()));
    }
}
