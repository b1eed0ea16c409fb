package com.evidex.core.content;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A readable file for one evidence row. Temporary copies are deleted on close.
 */
public record LocalCopy(Path path, boolean temporary) implements AutoCloseable {

    private static final Logger log = Logger.getLogger(LocalCopy.class);

    @Override
    public void close() {
        if (!temporary) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warnf("Could not delete temp copy %s: %s", path, e.getMessage());
        }
    }
}
