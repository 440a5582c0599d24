package in.worldsync.application.service;

import in.worldsync.infrastructure.metrics.IngestMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the subscription callback and the batch flusher.
 *
 * Producers never block: when the queue is full the offered element is dropped and
 * counted. Elements that were accepted are never evicted.
 */
public final class IngestionQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(IngestionQueue.class);

    private static final long DROP_LOG_EVERY = 100;

    private final String name;
    private final int capacity;
    private final BlockingQueue<T> queue;
    private final IngestMetrics metrics;
    private final AtomicLong dropped = new AtomicLong();

    public IngestionQueue(String name, int capacity, IngestMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive");
        }
        this.name = name;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = metrics;
    }

    /**
     * @return false when the queue was full and the element was dropped
     */
    public boolean offer(T element) {
        if (queue.offer(element)) {
            metrics.recordQueueDepth(name, queue.size());
            return true;
        }

        long total = dropped.incrementAndGet();
        metrics.recordQueueDrop(name);
        if (total == 1 || total % DROP_LOG_EVERY == 0) {
            log.warn("[QUEUE] {} full ({} elements), dropped {} so far", name, capacity, total);
        }
        return false;
    }

    /**
     * Wait up to {@code timeout} for an element; null on timeout.
     */
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T element = queue.poll(timeout, unit);
        if (element != null) {
            metrics.recordQueueDepth(name, queue.size());
        }
        return element;
    }

    public T poll(Duration timeout) throws InterruptedException {
        return poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Move up to {@code maxElements} queued elements into {@code target} without waiting.
     */
    public int drainTo(Collection<? super T> target, int maxElements) {
        int moved = queue.drainTo(target, maxElements);
        if (moved > 0) {
            metrics.recordQueueDepth(name, queue.size());
        }
        return moved;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public String name() {
        return name;
    }
}
