package com.evidex.core.hash;

/**
 * Counts from one {@link HashBackfillService#backfillCase} run.
 */
public record BackfillResult(int candidates, int hashed, int failed) {
}
