package com.evidex.formats.api;

/**
 * Receives {@code (current, total, message)} progress reports.
 * A {@code total} of zero or less means the total is not known yet.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total, message) -> { };

    void onProgress(int current, int total, String message);

    /**
     * Maps this listener's reports onto {@code [start, start + span]} of a
     * 0..100 scale owned by {@code target}.
     */
    static ProgressListener scaled(ProgressListener target, int start, int span) {
        if (target == null || target == NONE) {
            return NONE;
        }
        return (current, total, message) -> {
            int value = total > 0
                    ? start + (int) ((long) span * Math.min(current, total) / total)
                    : start;
            target.onProgress(value, 100, message);
        };
    }

    static ProgressListener orNone(ProgressListener listener) {
        return listener == null ? NONE : listener;
    }
}
