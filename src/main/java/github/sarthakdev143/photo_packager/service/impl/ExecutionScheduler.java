package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.SourceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task per source entry on a bounded pool, or on the calling thread when a single
 * worker is requested. Cancellation is observed between files only.
 */
@Component
public class ExecutionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionScheduler.class);

    public interface FileTask {

        void process(SourceEntry entry);

        /**
         * Called instead of {@link #process} for entries not started before cancellation.
         */
        void cancelled(SourceEntry entry);
    }

    public record ExecutionReport(int workers, int processed, int cancelled) {
    }

    public ExecutionReport execute(
            List<SourceEntry> entries,
            int requestedWorkers,
            AtomicBoolean cancelRequested,
            FileTask task) {
        int workers = resolveWorkerCount(requestedWorkers);
        AtomicInteger processed = new AtomicInteger();
        AtomicInteger cancelled = new AtomicInteger();

        if (workers == 1 || entries.size() <= 1) {
            for (SourceEntry entry : entries) {
                runOne(entry, cancelRequested, task, processed, cancelled);
            }
            return new ExecutionReport(1, processed.get(), cancelled.get());
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, entries.size()), workerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(entries.size());
            for (SourceEntry entry : entries) {
                futures.add(pool.submit(() -> runOne(entry, cancelRequested, task, processed, cancelled)));
            }
            for (Future<?> future : futures) {
                awaitCompletion(future, cancelRequested);
            }
        } finally {
            pool.shutdown();
            awaitTermination(pool);
        }

        logger.debug("Scheduler finished processed={} cancelled={} workers={}", processed.get(), cancelled.get(), workers);
        return new ExecutionReport(workers, processed.get(), cancelled.get());
    }

    static int resolveWorkerCount(int requestedWorkers) {
        if (requestedWorkers <= 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors());
        }
        return requestedWorkers;
    }

    private void runOne(
            SourceEntry entry,
            AtomicBoolean cancelRequested,
            FileTask task,
            AtomicInteger processed,
            AtomicInteger cancelled) {
        if (cancelRequested.get()) {
            task.cancelled(entry);
            cancelled.incrementAndGet();
            return;
        }
        try {
            task.process(entry);
        } catch (RuntimeException e) {
            logger.error("Task for source #{} {} failed unexpectedly", entry.sequence(), entry.path(), e);
        }
        processed.incrementAndGet();
    }

    private void awaitCompletion(Future<?> future, AtomicBoolean cancelRequested) {
        try {
            future.get();
        } catch (InterruptedException e) {
            // queued files see the flag and skip; in-flight files finish during shutdown
            cancelRequested.set(true);
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.error("Worker task failed", e.getCause());
        }
    }

    private void awaitTermination(ExecutorService pool) {
        boolean interrupted = false;
        try {
            while (!pool.isTerminated()) {
                try {
                    pool.awaitTermination(1, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "photo-packager-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
