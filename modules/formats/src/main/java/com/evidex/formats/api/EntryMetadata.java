package com.evidex.formats.api;

import java.nio.file.attribute.FileTime;
import java.time.Instant;

/**
 * Timestamps recorded for a container entry.
 * Nullable fields: only populated when the container format provides them.
 */
public record EntryMetadata(
        Instant mtime,
        Instant ctime,
        Instant atime
) {
    public static final EntryMetadata EMPTY = new EntryMetadata(null, null, null);

    /** Convenience: entry with only mtime. */
    public static EntryMetadata ofMtime(Instant mtime) {
        return new EntryMetadata(mtime, null, null);
    }

    public static EntryMetadata of(FileTime mtime, FileTime ctime, FileTime atime) {
        return new EntryMetadata(toInstant(mtime), toInstant(ctime), toInstant(atime));
    }

    private static Instant toInstant(FileTime time) {
        // DOS timestamps of zero decode to 1980-01-01; treat negative epoch as absent
        if (time == null || time.toMillis() <= 0) {
            return null;
        }
        return time.toInstant();
    }
}
