package com.evidex.api.dto;

import java.util.List;
import java.util.function.Predicate;

/**
 * @param path      container or folder on the server
 * @param mode      {@code index} (default), {@code full} or {@code directory}
 * @param workers   worker count, or null for the configured default
 * @param targetDir extraction directory for {@code full}, or null for a temp dir
 * @param include   entry path prefixes to extract in {@code full} mode; empty means all
 */
public record IngestRequest(
        String path,
        String mode,
        Integer workers,
        String targetDir,
        List<String> include
) {
    public String modeOrDefault() {
        return mode == null || mode.isBlank() ? "index" : mode.trim().toLowerCase();
    }

    public Predicate<String> entryFilter() {
        if (include == null || include.isEmpty()) {
            return entry -> true;
        }
        return entry -> include.stream().anyMatch(entry::startsWith);
    }
}
