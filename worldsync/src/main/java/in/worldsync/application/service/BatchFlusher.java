package in.worldsync.application.service;

import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.domain.model.DetectionActivityEvent;
import in.worldsync.domain.model.DetectionActivityRecord;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single consumer of the ingestion queue.
 *
 * Records are prepared as they are taken and appended to the current batch. The batch
 * is flushed when it reaches {@code maxBatchSize} (trigger "size") or when no record has
 * been taken for {@code idleTimeout} while it is non-empty (trigger "idle"). An idle
 * timeout with an empty batch only restarts the wait.
 *
 * Each batch is handed to the store exactly once. A failed write is logged and counted
 * and the worker carries on with a fresh batch.
 */
public final class BatchFlusher {
    private static final Logger log = LoggerFactory.getLogger(BatchFlusher.class);

    static final String TRIGGER_SIZE = "size";
    static final String TRIGGER_IDLE = "idle";
    static final String TRIGGER_SHUTDOWN = "shutdown";

    // upper bound on one blocking poll so a stop request is noticed promptly
    private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

    private final IngestionQueue<DetectionActivityEvent> queue;
    private final DetectionActivityPreparer preparer;
    private final ActivityStore store;
    private final IngestMetrics metrics;
    private final int maxBatchSize;
    private final long idleTimeoutNanos;
    private final boolean collapseByTag;
    private final ExecutorService worker;

    private final AtomicLong batchesFlushed = new AtomicLong();
    private final AtomicLong recordsFlushed = new AtomicLong();
    private final AtomicLong recordsRejected = new AtomicLong();
    private volatile boolean running = false;

    public BatchFlusher(IngestionQueue<DetectionActivityEvent> queue,
                        DetectionActivityPreparer preparer,
                        ActivityStore store,
                        IngestMetrics metrics,
                        int maxBatchSize,
                        Duration idleTimeout,
                        boolean collapseByTag) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.queue = queue;
        this.preparer = preparer;
        this.store = store;
        this.metrics = metrics;
        this.maxBatchSize = maxBatchSize;
        this.idleTimeoutNanos = idleTimeout.toNanos();
        this.collapseByTag = collapseByTag;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "batch-flusher");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[FLUSHER] Already running");
            return;
        }
        running = true;
        worker.submit(this::runLoop);
        log.info("[FLUSHER] Started: maxBatch={}, idle={}ms, collapseByTag={}",
            maxBatchSize, TimeUnit.NANOSECONDS.toMillis(idleTimeoutNanos), collapseByTag);
    }

    /**
     * Stop taking new work, flush what is already queued, and wait for the worker.
     * A flush in progress is never interrupted.
     */
    public void stop(Duration timeout) {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        worker.shutdown();
        try {
            if (!worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[FLUSHER] Worker did not finish within {}ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[FLUSHER] Stopped: {} batches, {} records flushed, {} rejected",
            batchesFlushed.get(), recordsFlushed.get(), recordsRejected.get());
    }

    private void runLoop() {
        List<DetectionActivityRecord> batch = new ArrayList<>(maxBatchSize);
        long lastTake = System.nanoTime();

        try {
            while (running) {
                long wait = idleTimeoutNanos;
                if (!batch.isEmpty()) {
                    wait = lastTake + idleTimeoutNanos - System.nanoTime();
                    if (wait <= 0) {
                        flush(batch, TRIGGER_IDLE);
                        batch = new ArrayList<>(maxBatchSize);
                        continue;
                    }
                }

                DetectionActivityEvent event = queue.poll(Math.min(wait, POLL_SLICE_NANOS), TimeUnit.NANOSECONDS);
                if (event == null) {
                    continue;
                }
                lastTake = System.nanoTime();

                if (accept(event, batch) && batch.size() >= maxBatchSize) {
                    flush(batch, TRIGGER_SIZE);
                    batch = new ArrayList<>(maxBatchSize);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[FLUSHER] Interrupted, flushing what is left");
        }

        drainRemaining(batch);
    }

    private void drainRemaining(List<DetectionActivityRecord> batch) {
        List<DetectionActivityEvent> rest = new ArrayList<>();
        queue.drainTo(rest, Integer.MAX_VALUE);
        for (DetectionActivityEvent event : rest) {
            if (accept(event, batch) && batch.size() >= maxBatchSize) {
                flush(batch, TRIGGER_SHUTDOWN);
                batch = new ArrayList<>(maxBatchSize);
            }
        }
        if (!batch.isEmpty()) {
            flush(batch, TRIGGER_SHUTDOWN);
        }
    }

    private boolean accept(DetectionActivityEvent event, List<DetectionActivityRecord> batch) {
        try {
            batch.add(preparer.prepare(event));
            return true;
        } catch (RecordValidationException e) {
            recordsRejected.incrementAndGet();
            metrics.recordValidationFailure(e.getReason());
            log.warn("[FLUSHER] Skipping record: {}", e.getMessage());
            return false;
        }
    }

    private void flush(List<DetectionActivityRecord> batch, String trigger) {
        List<DetectionActivityRecord> rows = collapseByTag ? collapse(batch) : List.copyOf(batch);
        long start = System.nanoTime();
        try {
            store.insertDetectionBatch(rows);
            batchesFlushed.incrementAndGet();
            recordsFlushed.addAndGet(batch.size());
            log.info("[FLUSHER] ✓ Flushed {} records as {} rows ({})", batch.size(), rows.size(), trigger);
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure(e.getOperation());
            log.error("[FLUSHER] Lost batch of {} records ({}): {}", batch.size(), trigger, e.getMessage());
        } catch (RuntimeException e) {
            metrics.recordPersistenceFailure("insert_detection_batch");
            log.error("[FLUSHER] Lost batch of {} records ({})", batch.size(), trigger, e);
        }
        metrics.recordBatchFlush(trigger, batch.size(), Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * Merge records sharing a source id and tag into one row; the row keeps the
     * first record's timestamp and counts the merged records.
     */
    static List<DetectionActivityRecord> collapse(List<DetectionActivityRecord> batch) {
        Map<List<String>, DetectionActivityRecord> merged = new LinkedHashMap<>();
        for (DetectionActivityRecord record : batch) {
            merged.merge(
                Arrays.asList(record.sourceId(), record.tag()),
                record,
                (first, next) -> first.withEventCount(first.eventCount() + next.eventCount()));
        }
        return List.copyOf(merged.values());
    }

    public boolean isRunning() {
        return running;
    }

    public long batchesFlushed() {
        return batchesFlushed.get();
    }

    public long recordsFlushed() {
        return recordsFlushed.get();
    }

    public long recordsRejected() {
        return recordsRejected.get();
    }
}
