package com.evidex.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Streams content through a SHA-256 digest in fixed-size chunks,
 * so memory use does not depend on the size of the evidence file.
 */
public final class ContentHasher {

    private static final int BUFFER_SIZE = 16 * 1024;

    private ContentHasher() {
    }

    public static ContentHash hash(InputStream in) throws IOException {
        MessageDigest digest = newDigest();
        byte[] chunk = new byte[BUFFER_SIZE];
        int read;
        while ((read = in.read(chunk)) != -1) {
            digest.update(chunk, 0, read);
        }
        return new ContentHash(digest.digest());
    }

    public static ContentHash hash(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return hash(in);
        }
    }

    public static ContentHash hash(byte[] data) {
        return new ContentHash(newDigest().digest(data));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ContentHash.ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE is required to ship SHA-256
            throw new IllegalStateException(ContentHash.ALGORITHM + " not available", e);
        }
    }
}
