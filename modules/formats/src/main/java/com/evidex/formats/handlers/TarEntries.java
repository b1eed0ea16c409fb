package com.evidex.formats.handlers;

import com.evidex.formats.api.EntryMetadata;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;

final class TarEntries {

    private TarEntries() {
    }

    static EntryMetadata metadata(TarArchiveEntry entry) {
        return EntryMetadata.of(entry.getLastModifiedTime(), entry.getCreationTime(), entry.getLastAccessTime());
    }
}
