package com.evidex.core.search;

import java.time.LocalDate;

/**
 * Inclusive day range. Either end may be open (null), not both.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        if (from == null && to == null) {
            throw new IllegalArgumentException("A date range needs at least one bound");
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("Date range starts after it ends: " + from + " > " + to);
        }
    }

    public static DateRange between(LocalDate from, LocalDate to) {
        return new DateRange(from, to);
    }

    public boolean contains(LocalDate day) {
        return (from == null || !day.isBefore(from)) && (to == null || !day.isAfter(to));
    }
}
