package com.evidex.core.ingest;

import com.evidex.core.dao.NewEvidenceFile;
import com.evidex.formats.category.ForensicCategorizer;
import com.evidex.types.EvidenceCategory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Lists an already-extracted folder tree and maps its files onto evidence rows.
 */
@ApplicationScoped
public class DirectoryImporter {

    @Inject
    ForensicCategorizer categorizer;

    public DirectoryImporter() {
    }

    public DirectoryImporter(ForensicCategorizer categorizer) {
        this.categorizer = categorizer;
    }

    /**
     * Every regular file below {@code root}, in path order. Symbolic links
     * are not followed.
     */
    public List<Path> listFiles(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(p -> Files.isRegularFile(p))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Builds the row for one file on disk. The relative path is taken
     * against {@code root}; a file outside the root keeps only its name.
     *
     * @param sourceArchive container the tree was extracted from, or null
     * @throws UncheckedIOException if the file's attributes cannot be read
     */
    public NewEvidenceFile toEvidence(long caseId, Path root, Path file, String sourceArchive) {
        Path absolute = file.toAbsolutePath().normalize();
        Path base = root.toAbsolutePath().normalize();
        String name = absolute.getFileName().toString();
        String relative = absolute.startsWith(base)
                ? base.relativize(absolute).toString().replace('\\', '/')
                : name;
        Path parent = absolute.getParent();
        String parentFolder = parent == null || parent.getFileName() == null ? "" : parent.getFileName().toString();
        EvidenceCategory category = categorizer.categorize(name, relative, null, parentFolder);

        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(absolute, BasicFileAttributes.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read attributes of " + absolute, e);
        }

        return new NewEvidenceFile(
                caseId,
                absolute.toString(),
                relative,
                name,
                category,
                attrs.size(),
                null,
                sourceArchive,
                instant(attrs.creationTime()),
                instant(attrs.lastModifiedTime()),
                instant(attrs.lastAccessTime()),
                null,
                null, null, null,
                null, null);
    }

    private static Instant instant(FileTime time) {
        return time == null || time.toMillis() <= 0 ? null : time.toInstant();
    }
}
