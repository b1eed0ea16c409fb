package com.evidex.formats.api;

import java.io.IOException;
import java.io.InputStream;

/**
 * Transport-level wrapper around a container, e.g. the gzip layer of a
 * {@code .tar.gz}. Decoding is streaming: nothing is buffered beyond the
 * decompressor's own window.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface Codec {
    /**
     * Checks if this codec can handle the given file.
     *
     * @param header   First N bytes of the file (typically 8-16 bytes)
     * @param filename Original filename (may contain hints like .gz extension)
     * @return true if this codec should handle the file
     */
    boolean matches(byte[] header, String filename);

    /**
     * Wraps the encoded stream in a decoding stream.
     * Closing the returned stream closes {@code encoded}.
     */
    InputStream decode(InputStream encoded) throws IOException;

    /** Short name used in log lines. */
    String name();
}
