package com.evidex.core.content;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Entries of one container unpacked to a temp directory in a single pass.
 * The directory and everything under it is removed on close.
 */
public final class UnpackedContainer implements AutoCloseable {

    private static final Logger log = Logger.getLogger(UnpackedContainer.class);

    private final String sourceArchive;
    private final Path directory;

    UnpackedContainer(String sourceArchive, Path directory) {
        this.sourceArchive = sourceArchive;
        this.directory = directory.toAbsolutePath().normalize();
    }

    public String sourceArchive() {
        return sourceArchive;
    }

    /**
     * Returns the unpacked copy of {@code entryPath}. The copy is owned by
     * this container, closing it does not delete anything.
     *
     * @throws NoSuchFileException if the entry was not unpacked
     */
    public LocalCopy copyOf(String entryPath) throws IOException {
        String relative = entryPath.replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path target = directory.resolve(relative).normalize();
        if (!target.startsWith(directory) || !Files.isRegularFile(target)) {
            throw new NoSuchFileException(entryPath, sourceArchive, "Entry was not unpacked");
        }
        return new LocalCopy(target, false);
    }

    @Override
    public void close() {
        deleteTree(directory);
    }

    static void deleteTree(Path root) {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warnf("Could not remove unpacked content %s: %s", root, e.getMessage());
        }
    }
}
