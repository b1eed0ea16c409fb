package com.evidex.core.ingest;

import com.evidex.core.repository.SqlStates;
import org.jboss.logging.Logger;

import java.util.function.Supplier;

/**
 * Retries an insert that failed with a transient lock or timeout error,
 * doubling the pause after each attempt. Other failures are rethrown at once.
 */
public record InsertRetryPolicy(int maxRetries, long baseBackoffMillis) {

    private static final Logger log = Logger.getLogger(InsertRetryPolicy.class);

    public InsertRetryPolicy {
        if (maxRetries < 0 || baseBackoffMillis < 0) {
            throw new IllegalArgumentException("maxRetries and baseBackoffMillis must be >= 0");
        }
    }

    public <T> T execute(String itemName, Supplier<T> insert) {
        int attempt = 0;
        while (true) {
            try {
                return insert.get();
            } catch (RuntimeException e) {
                if (attempt >= maxRetries || !SqlStates.isTransient(e)) {
                    throw e;
                }
                long pause = baseBackoffMillis << attempt;
                attempt++;
                log.debugf("Transient failure inserting %s (attempt %d), retrying in %d ms",
                        itemName, attempt, pause);
                sleep(pause);
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry insert", e);
        }
    }
}
