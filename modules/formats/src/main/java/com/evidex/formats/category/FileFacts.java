package com.evidex.formats.category;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Normalised view of a file that category rules match against.
 * All strings are lowercase; paths use {@code /} separators.
 *
 * @param name         base file name
 * @param path         full path, as recorded in the container or on disk
 * @param extension    extension without the dot, or empty
 * @param parentFolder name of the immediate parent folder, or empty
 * @param segments     directory segments of {@code path}, excluding the file name
 */
public record FileFacts(
        String name,
        String path,
        String extension,
        String parentFolder,
        List<String> segments
) {
    public FileFacts {
        segments = List.copyOf(segments);
    }

    public static FileFacts of(String name, String path, String extension, String parentFolder) {
        String normalisedPath = normalise(path);
        String normalisedName = normalise(name);
        if (normalisedName.isEmpty()) {
            normalisedName = baseName(normalisedPath);
        }
        String ext = normalise(extension);
        if (ext.startsWith(".")) {
            ext = ext.substring(1);
        }
        if (ext.isEmpty()) {
            ext = extensionOf(normalisedName);
        }
        String parent = normalise(parentFolder);
        List<String> dirs = directorySegments(normalisedPath);
        if (parent.isEmpty() && !dirs.isEmpty()) {
            parent = dirs.get(dirs.size() - 1);
        }
        return new FileFacts(normalisedName, normalisedPath, ext, parent, dirs);
    }

    /** Derives every field from a single entry or file path. */
    public static FileFacts fromPath(String path) {
        return of(null, path, null, null);
    }

    private static String normalise(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\\', '/').trim().toLowerCase(Locale.ROOT);
    }

    private static String baseName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : "";
    }

    private static List<String> directorySegments(String path) {
        int slash = path.lastIndexOf('/');
        if (slash <= 0) {
            return List.of();
        }
        return Arrays.stream(path.substring(0, slash).split("/"))
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
