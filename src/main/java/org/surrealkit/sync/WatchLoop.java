package org.surrealkit.sync;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.surrealkit.obs.CorrelationContext;
import org.surrealkit.obs.JsonLinesLogger;

/**
 * Re-runs reconciliation on a fixed interval until cancelled.
 *
 * <p>Cancellation is checked only between passes; a pass in flight always completes.
 */
public final class WatchLoop {
    public static final Duration MINIMUM_INTERVAL = Duration.ofMillis(250);

    private final SyncReconciler reconciler;
    private final SyncOptions options;
    private final Duration interval;
    private final JsonLinesLogger logger;
    private final CorrelationContext correlation;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicInteger passes = new AtomicInteger();

    public WatchLoop(
            final SyncReconciler reconciler,
            final SyncOptions options,
            final Duration interval,
            final JsonLinesLogger logger,
            final CorrelationContext correlation) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.options = Objects.requireNonNull(options, "options");
        final Duration requested = Objects.requireNonNull(interval, "interval");
        this.interval = requested.compareTo(MINIMUM_INTERVAL) < 0 ? MINIMUM_INTERVAL : requested;
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlation = Objects.requireNonNull(correlation, "correlation");
    }

    public Duration interval() {
        return interval;
    }

    public int completedPasses() {
        return passes.get();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Runs the first pass immediately, then one pass per interval until {@link #cancel()}.
     * Errors of the first pass always propagate; later errors propagate only under fail-fast.
     */
    public void run() throws IOException {
        reconciler.runOnce(options);
        passes.incrementAndGet();
        logger.info("watching schema directory", correlation, Map.of("intervalMs", interval.toMillis()));
        while (!awaitCancellation()) {
            try {
                reconciler.runOnce(options);
            } catch (final IOException | RuntimeException exception) {
                if (options.failFast()) {
                    throw exception;
                }
                logger.error("sync iteration failed", correlation,
                        Map.of("error", String.valueOf(exception.getMessage())));
            }
            passes.incrementAndGet();
        }
        logger.info("stopped schema watch", correlation, Map.of("passes", passes.get()));
    }

    private boolean awaitCancellation() {
        try {
            return cancelled.await(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException exception) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }
}
