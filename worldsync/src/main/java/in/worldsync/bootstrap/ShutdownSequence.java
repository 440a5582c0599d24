package in.worldsync.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Ordered stop steps plus the latch the main thread parks on.
 *
 * Worker threads are daemons, so the process lives exactly as long as the main
 * thread is parked in {@link #awaitShutdown()}. {@link #run()} executes the steps
 * in registration order (once; a failing step is logged and the rest still run),
 * then releases the main thread.
 */
final class ShutdownSequence implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ShutdownSequence.class);

    private record Step(String name, Runnable action) {}

    private final List<Step> steps = new ArrayList<>();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private boolean ran = false;

    synchronized ShutdownSequence then(String name, Runnable action) {
        steps.add(new Step(name, action));
        return this;
    }

    @Override
    public void run() {
        synchronized (this) {
            if (ran) {
                return;
            }
            ran = true;
        }
        log.info("[SHUTDOWN] Stopping WorldSync...");
        try {
            for (Step step : steps) {
                try {
                    step.action().run();
                } catch (RuntimeException e) {
                    log.error("[SHUTDOWN] Step '{}' failed: {}", step.name(), e.getMessage(), e);
                }
            }
            log.info("[SHUTDOWN] ✓ Stopped");
        } finally {
            stopped.countDown();
        }
    }

    /**
     * Block until {@link #run()} has finished.
     */
    void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    boolean isStopped() {
        return stopped.getCount() == 0;
    }
}
