// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.Unwind;

/**
 * Runs a function over every element of a collection on an {@link ExecutorService}.
 * <p>
 * Each task inherits the submitting thread's restarts and thread-safe handlers, so a condition signaled on a worker
 * is handled exactly as if it had been signaled by the submitter. An unwind to one of the submitter's restarts
 * escapes its task and is rethrown in the submitting thread once the remaining tasks have been cancelled.
 */
public final class CollectionExecutorService {
    public CollectionExecutorService(final ExecutorService executorService) {
        this.executorService = executorService;
    }

    /**
     * Applies the consumer to every element concurrently. Waits for every task.
     */
    public <T> void forEach(final Collection<? extends T> collection, final Consumer<? super T> consumer) {
        final var futures = submitAll(collection, item -> {
            consumer.accept(item);
            return null;
        });
        awaitAll(futures, ignored -> {
        });
    }

    private <T, R> List<Future<R>> submitAll(
        final Collection<? extends T> collection,
        final Function<? super T, ? extends R> function
    ) {
        final var inheritedState = ConditionContext.saveInheritableState();
        final var futures = new ArrayList<Future<R>>(collection.size());
        for (final T item : collection) {
            futures.add(executorService.submit(() -> {
                final var previousState = ConditionContext.inheritState(inheritedState);
                try (final var trace = new Trace(() -> "Running a task on " + Thread.currentThread().getName())) {
                    trace.use();
                    return function.apply(item);
                } finally {
                    ConditionContext.restoreState(previousState);
                }
            }));
        }
        return futures;
    }

    private static <R> void awaitAll(final List<Future<R>> futures, final Consumer<? super R> sink) {
        boolean sawInterrupt = false;
        int index = 0;
        try {
            for (; index < futures.size(); index += 1) {
                try {
                    sink.accept(futures.get(index).get());
                } catch (final InterruptedException e) {
                    throw SneakyThrow.doThrow(e);
                } catch (final ExecutionException e) {
                    final var cause = e.getCause();
                    if (cause instanceof InterruptedException) {
                        // Another task probably failed for a more interesting reason; keep looking.
                        sawInterrupt = true;
                        continue;
                    }
                    cancelFrom(futures, index + 1);
                    if (cause instanceof Unwind) {
                        throw SneakyThrow.doThrow(cause);
                    }
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw new AssertionError("A task failed with an exception instead of a condition", cause);
                }
            }
        } finally {
            if (index < futures.size()) {
                cancelFrom(futures, index);
            }
        }
        if (sawInterrupt) {
            throw new AssertionError("A task was interrupted, but no task failed for any other reason");
        }
    }

    private static void cancelFrom(final List<? extends Future<?>> futures, final int start) {
        for (int i = start; i < futures.size(); i += 1) {
            futures.get(i).cancel(true);
        }
    }

    private final ExecutorService executorService;
}
