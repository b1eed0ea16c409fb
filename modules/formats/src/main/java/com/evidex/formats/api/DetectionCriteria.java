package com.evidex.formats.api;

import java.util.Arrays;
import java.util.Set;

/**
 * Criteria for recognising a container an {@link IndexerFactory} can open.
 *
 * @param mimeTypes    MIME types to match (e.g., "application/zip", "application/*")
 * @param extensions   File extensions without dot (e.g., "zip", "ufdr")
 * @param magicBytes   Magic bytes to match, or null if not applicable
 * @param magicOffset  Offset in header where magic bytes start (0 for most formats, 257 for TAR)
 * @param priority     Higher priority wins when several factories match
 */
public record DetectionCriteria(
        Set<String> mimeTypes,
        Set<String> extensions,
        byte[] magicBytes,
        int magicOffset,
        int priority
) {
    public DetectionCriteria {
        mimeTypes = Set.copyOf(mimeTypes);
        extensions = Set.copyOf(extensions);
        if (magicBytes != null) {
            magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
        }
    }

    /**
     * Checks if this criteria matches the given file properties.
     */
    public boolean matches(String mimeType, String filename, byte[] header) {
        return matchesSignature(mimeType, header) || matchesExtension(filename);
    }

    /**
     * Content-only check: magic bytes first, then the sniffed MIME type.
     * Used when the file name carries no usable extension.
     */
    public boolean matchesSignature(String mimeType, byte[] header) {
        if (magicBytes != null && header != null) {
            int endOffset = magicOffset + magicBytes.length;
            if (header.length >= endOffset) {
                boolean magicMatch = true;
                for (int i = 0; i < magicBytes.length; i++) {
                    if (header[magicOffset + i] != magicBytes[i]) {
                        magicMatch = false;
                        break;
                    }
                }
                if (magicMatch) {
                    return true;
                }
            }
        }

        if (mimeType == null) {
            return false;
        }
        if (mimeTypes.contains(mimeType)) {
            return true;
        }
        String baseType = mimeType.split("/")[0];
        return mimeTypes.contains(baseType + "/*");
    }

    public boolean matchesExtension(String filename) {
        if (filename == null) {
            return false;
        }
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex > 0) {
            String ext = filename.substring(dotIndex + 1).toLowerCase();
            return extensions.contains(ext);
        }
        return false;
    }
}
