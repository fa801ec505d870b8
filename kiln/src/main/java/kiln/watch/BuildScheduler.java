// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.watch;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import kiln.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a stream of change notifications into build passes.
 * <p>
 * Requests are debounced: a pass starts only once no request has arrived for the quiet period. At most one pass runs
 * at a time, and any number of requests arriving while a pass runs result in exactly one follow-up pass.
 * <p>
 * This class is thread-safe.
 */
public final class BuildScheduler implements AutoCloseable {
    public BuildScheduler(final Runnable build, final Duration debounce) {
        this.build = build;
        this.debounce = debounce;
    }

    /**
     * Asks for a build pass.
     */
    public void request() {
        lock.lock();
        try {
            pending = true;
            if (running) {
                return;
            }
            final var previous = scheduled;
            if (previous != null) {
                previous.cancel(false);
            }
            scheduled = executor.schedule(this::runPass, debounce.toNanos(), TimeUnit.NANOSECONDS);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The number of passes completed so far.
     */
    public int completedPasses() {
        lock.lock();
        try {
            return completedPasses;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops scheduling passes and waits for a running pass to finish.
     */
    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("A build pass did not finish within {} seconds of shutdown", shutdownTimeoutSeconds);
            }
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    private void runPass() {
        lock.lock();
        try {
            if (!pending) {
                return;
            }
            pending = false;
            running = true;
            scheduled = null;
        } finally {
            lock.unlock();
        }
        try {
            build.run();
        } catch (final RuntimeException e) {
            logger.error("Build pass failed unexpectedly", e);
        } finally {
            lock.lock();
            try {
                running = false;
                completedPasses += 1;
                if (pending && !executor.isShutdown()) {
                    scheduled = executor.schedule(this::runPass, debounce.toNanos(), TimeUnit.NANOSECONDS);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private final Runnable build;
    private final Duration debounce;
    private final ReentrantLock lock = new ReentrantLock();
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(
        runnable -> new Thread(runnable, "build-scheduler")
    );
    private boolean pending = false;
    private boolean running = false;
    private int completedPasses = 0;
    private @Nullable ScheduledFuture<?> scheduled = null;

    private static final long shutdownTimeoutSeconds = 60;
    private static final Logger logger = LoggerFactory.getLogger(BuildScheduler.class);
}
