package com.evidex.formats.api;

import com.evidex.types.EvidenceCategory;

import java.time.Instant;
import java.util.Objects;

/**
 * One file discovered inside a forensic container.
 *
 * <p>Produced by an {@link ArchiveIndexer} without reading the entry's
 * content. {@code indexed} is true when the entry was only listed and never
 * written to disk; {@code hash} stays null until a backfill computes it.
 *
 * @param name          base name of the entry
 * @param path          full entry path inside the container
 * @param size          uncompressed size in bytes (0 when the container does not say)
 * @param timestamps    entry timestamps, possibly empty
 * @param category      category inferred from name and path
 * @param sourceArchive absolute path of the container the entry lives in
 * @param indexed       true when the content was not extracted
 * @param hash          lowercase SHA-256 hex, or null
 */
public record FileDescriptor(
        String name,
        String path,
        long size,
        EntryMetadata timestamps,
        EvidenceCategory category,
        String sourceArchive,
        boolean indexed,
        String hash
) {
    public FileDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(category, "category");
        timestamps = timestamps == null ? EntryMetadata.EMPTY : timestamps;
    }

    public Instant modified() {
        return timestamps.mtime();
    }

    /** Lowercase extension without the dot, or empty. */
    public String extension() {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase() : "";
    }
}
