package com.evidex.formats.handlers;

import com.evidex.formats.api.ArchiveIndexer;
import com.evidex.formats.api.CorruptEntryException;
import com.evidex.formats.api.EntryMetadata;
import com.evidex.formats.api.FileContext;
import com.evidex.formats.api.FileDescriptor;
import com.evidex.formats.category.FileFacts;
import com.evidex.types.EvidenceCategory;
import com.evidex.types.ExtractionFormat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;

/**
 * Shared plumbing for the container indexers: descriptor construction,
 * safe target resolution and entry writing.
 */
abstract class AbstractArchiveIndexer implements ArchiveIndexer {

    protected final FileContext context;
    private final String sourceArchive;

    AbstractArchiveIndexer(FileContext context) {
        this.context = context;
        this.sourceArchive = context.source().toAbsolutePath().toString();
    }

    @Override
    public ExtractionFormat format() {
        return context.format();
    }

    protected FileDescriptor describe(String entryPath, long size, EntryMetadata metadata) {
        EvidenceCategory category = context.categorizer().categorize(FileFacts.fromPath(entryPath));
        return new FileDescriptor(baseName(entryPath), entryPath, Math.max(0, size), metadata,
                category, sourceArchive, true, null);
    }

    static String baseName(String entryPath) {
        String trimmed = entryPath.endsWith("/")
                ? entryPath.substring(0, entryPath.length() - 1) : entryPath;
        int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    /**
     * Resolves {@code entryPath} below {@code targetDir}, rejecting entries
     * that would land outside it ("zip slip").
     */
    static Path resolveTarget(Path targetDir, String entryPath) {
        Path root = targetDir.toAbsolutePath().normalize();
        String relative = entryPath.replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new CorruptEntryException(entryPath, "Entry escapes extraction directory");
        }
        return target;
    }

    /** Copies {@code in} to {@code target} without closing {@code in}. */
    static void writeEntry(InputStream in, Path target, EntryMetadata metadata) throws IOException {
        Files.createDirectories(target.getParent());
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        if (metadata.mtime() != null) {
            Files.setLastModifiedTime(target, FileTime.from(metadata.mtime()));
        }
    }
}
