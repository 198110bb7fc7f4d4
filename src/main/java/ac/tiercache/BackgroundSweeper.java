package ac.tiercache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.ToIntFunction;

/**
 * Daemon thread that runs a sweep task every interval. The task receives a
 * cancellation check so {@link #close()} returns promptly even in the middle of
 * a large sweep. Used for L3 expiry and for L2 tag-index pruning.
 */
public class BackgroundSweeper implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BackgroundSweeper.class);

    private static final long JOIN_TIMEOUT_MILLIS = 5000;

    private final String name;
    private final Duration interval;
    private final ToIntFunction<BooleanSupplier> sweep;
    private final Thread worker;
    private volatile boolean cancelled;

    /**
     * @param sweep task returning how many records it removed
     */
    public BackgroundSweeper(String name, Duration interval, ToIntFunction<BooleanSupplier> sweep) {
        this.name = Objects.requireNonNull(name, "Sweeper name cannot be null");
        this.sweep = Objects.requireNonNull(sweep, "Sweep task cannot be null");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sweep interval must be positive, got " + interval);
        }
        this.interval = interval;
        this.worker = new Thread(this::run, name);
        this.worker.setDaemon(true);
    }

    static boolean isEnabled(Duration interval) {
        return interval != null && !interval.isZero() && !interval.isNegative();
    }

    public void start() {
        worker.start();
        logger.info("{} started with interval {}", name, interval);
    }

    private void run() {
        while (!isCancelled()) {
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                int removed = sweep.applyAsInt(this::isCancelled);
                logger.debug("{} removed {} records", name, removed);
            } catch (RuntimeException e) {
                logger.warn("{} failed: {}", name, e.getMessage(), e);
            }
        }
        logger.debug("{} loop exited", name);
    }

    boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    public boolean isRunning() {
        return worker.isAlive();
    }

    @Override
    public void close() {
        if (cancelled) return;
        cancelled = true;
        worker.interrupt();
        if (worker == Thread.currentThread()) return;
        try {
            worker.join(JOIN_TIMEOUT_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            logger.warn("{} did not stop within {} ms", name, JOIN_TIMEOUT_MILLIS);
        } else {
            logger.info("{} stopped", name);
        }
    }
}
