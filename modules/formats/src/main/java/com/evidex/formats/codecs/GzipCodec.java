package com.evidex.formats.codecs;

import com.evidex.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * Codec for GZIP compression (.gz files).
 * Handles both single .gz files and .tar.gz / .tgz archives.
 */
@ApplicationScoped
public class GzipCodec implements Codec {
    private static final byte[] GZIP_MAGIC = new byte[]{0x1f, (byte) 0x8b};

    @Override
    public boolean matches(byte[] header, String filename) {
        if (header != null && header.length >= 2) {
            if (header[0] == GZIP_MAGIC[0] && header[1] == GZIP_MAGIC[1]) {
                return true;
            }
        }

        if (filename != null) {
            String lower = filename.toLowerCase();
            return lower.endsWith(".gz") || lower.endsWith(".gzip") || lower.endsWith(".tgz");
        }

        return false;
    }

    @Override
    public InputStream decode(InputStream encoded) throws IOException {
        // Multi-member gzip (e.g. concatenated tar.gz parts) decodes as one stream
        return new GzipCompressorInputStream(encoded, true);
    }

    @Override
    public String name() {
        return "gzip";
    }
}
