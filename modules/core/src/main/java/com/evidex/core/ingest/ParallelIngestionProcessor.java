package com.evidex.core.ingest;

import com.evidex.core.dao.NewEvidenceFile;
import com.evidex.core.repository.CaseRepository;
import com.evidex.core.repository.FileRepository;
import com.evidex.formats.api.FileDescriptor;
import com.evidex.formats.api.ProgressListener;
import com.evidex.types.EvidenceCategory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.function.Function;

/**
 * Turns indexed items into evidence rows on a bounded pool of workers.
 *
 * <p>Workers pull the next item from a shared cursor, transform it and insert
 * it in its own transaction. A failing item is logged and counted, never
 * fatal. Progress is reported in completion order. Cancellation is checked
 * before each item is taken. Once every worker is done the case counters are
 * recounted exactly once.
 */
@ApplicationScoped
public class ParallelIngestionProcessor {

    private static final Logger log = Logger.getLogger(ParallelIngestionProcessor.class);
    private static final EvidenceCategory[] CATEGORIES = EvidenceCategory.values();

    @Inject
    FileRepository fileRepository;

    @Inject
    CaseRepository caseRepository;

    @ConfigProperty(name = "evidex.ingest.insert-retries", defaultValue = "3")
    int insertRetries;

    @ConfigProperty(name = "evidex.ingest.insert-backoff-ms", defaultValue = "50")
    long insertBackoffMs;

    /**
     * Inserts one row per indexed container entry.
     */
    public IngestionStats process(List<FileDescriptor> items, long caseId, int workerCount,
                                  ProgressListener progress, CancellationToken cancellation) {
        return process(items, item -> EvidenceRows.fromDescriptor(caseId, item), FileDescriptor::name,
                caseId, workerCount, progress, cancellation);
    }

    /**
     * Runs {@code transform} and the insert for every item.
     *
     * @param nameOf names an item for progress messages and logs
     */
    public <T> IngestionStats process(List<T> items, Function<T, NewEvidenceFile> transform,
                                      Function<T, String> nameOf, long caseId, int workerCount,
                                      ProgressListener progress, CancellationToken cancellation) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + workerCount);
        }
        ProgressListener listener = ProgressListener.orNone(progress);
        CancellationToken token = cancellation == null ? CancellationToken.create() : cancellation;
        InsertRetryPolicy retry = new InsertRetryPolicy(insertRetries, insertBackoffMs);

        int total = items.size();
        long started = System.nanoTime();
        RunState state = new RunState();

        int threads = Math.max(1, Math.min(workerCount, total));
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreads(caseId));
        try {
            for (int w = 0; w < threads; w++) {
                pool.execute(() -> drain(items, transform, nameOf, retry, token, listener, state));
            }
        } finally {
            pool.shutdown();
            awaitWorkers(pool, token);
        }

        caseRepository.recountCaseStatistics(caseId);

        double elapsed = (System.nanoTime() - started) / 1_000_000_000.0;
        boolean cancelled = token.isCancelled() && state.taken.get() < total;
        IngestionStats stats = new IngestionStats(total, state.processed.get(), state.errors.get(),
                state.categoryCounts(), elapsed, IngestionStats.rate(state.processed.get(), elapsed),
                null, cancelled);
        log.infof("Case %d: processed %d of %d items (%d errors%s) in %.2fs",
                caseId, stats.processed(), total, stats.errors(), cancelled ? ", cancelled" : "", elapsed);
        return stats;
    }

    private <T> void drain(List<T> items, Function<T, NewEvidenceFile> transform, Function<T, String> nameOf,
                           InsertRetryPolicy retry, CancellationToken token, ProgressListener listener,
                           RunState state) {
        int total = items.size();
        while (!token.isCancelled()) {
            int index = state.taken.getAndIncrement();
            if (index >= total) {
                return;
            }
            T item = items.get(index);
            String name = nameOf.apply(item);
            try {
                NewEvidenceFile row = transform.apply(item);
                retry.execute(name, () -> fileRepository.addFile(row));
                state.processed.incrementAndGet();
                state.categories.incrementAndGet(row.fileType().ordinal());
            } catch (RuntimeException e) {
                state.errors.incrementAndGet();
                log.warnf("Failed to ingest %s: %s", name, e.getMessage());
                log.debug("Ingest failure detail", e);
            }
            state.report(listener, total, name);
        }
    }

    private static void awaitWorkers(ExecutorService pool, CancellationToken token) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                // stop handing out items, let in-flight inserts finish
                interrupted = true;
                token.cancel();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads(long caseId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ingest-" + caseId + "-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class RunState {
        final AtomicInteger taken = new AtomicInteger();
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();
        final AtomicIntegerArray categories = new AtomicIntegerArray(CATEGORIES.length);
        private int completed;

        // serialized so listeners see a strictly increasing count
        synchronized void report(ProgressListener listener, int total, String name) {
            completed++;
            listener.onProgress(completed, total, "Processing: " + name);
        }

        Map<EvidenceCategory, Integer> categoryCounts() {
            Map<EvidenceCategory, Integer> counts = new EnumMap<>(EvidenceCategory.class);
            for (int i = 0; i < CATEGORIES.length; i++) {
                int count = categories.get(i);
                if (count > 0) {
                    counts.put(CATEGORIES[i], count);
                }
            }
            return counts;
        }
    }
}
