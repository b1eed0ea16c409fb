package com.evidex.core.ingest;

import com.evidex.core.dao.NewEvidenceFile;
import com.evidex.formats.api.EntryMetadata;
import com.evidex.formats.api.FileDescriptor;

/**
 * Maps pipeline descriptors onto evidence rows.
 */
public final class EvidenceRows {

    /** Separator between a container path and the entry path inside it. */
    public static final String CONTAINER_SEPARATOR = "!/";

    private EvidenceRows() {
    }

    /**
     * Row for an entry that was indexed but not extracted. {@code file_path}
     * is {@code <archive>!/<entry>}, the relative path is the entry path.
     */
    public static NewEvidenceFile fromDescriptor(long caseId, FileDescriptor descriptor) {
        EntryMetadata times = descriptor.timestamps();
        return new NewEvidenceFile(
                caseId,
                containerPath(descriptor.sourceArchive(), descriptor.path()),
                descriptor.path(),
                descriptor.name(),
                descriptor.category(),
                descriptor.size(),
                descriptor.hash(),
                descriptor.sourceArchive(),
                times.ctime(),
                times.mtime(),
                times.atime(),
                null,
                null, null, null,
                null, null);
    }

    public static String containerPath(String archive, String entryPath) {
        return archive == null ? entryPath : archive + CONTAINER_SEPARATOR + entryPath;
    }
}
