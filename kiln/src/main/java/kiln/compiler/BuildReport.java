// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import kiln.util.condition.Condition;

/**
 * The outcome of one build pass.
 *
 * @param status     The overall outcome.
 * @param rendered   The number of documents and books built.
 * @param skipped    The number of documents and books that were already up to date.
 * @param excluded   The number of drafts left out of a release build.
 * @param failed     The number of documents, books and redirects that failed.
 * @param copied     The number of assets copied.
 * @param redirected The number of redirect pages written.
 * @param failures   The detailed messages of the conditions that failed documents or aborted the pass.
 * @param warnings   The messages of the warnings signaled during the pass.
 */
public record BuildReport(
    Status status,
    int rendered,
    int skipped,
    int excluded,
    int failed,
    int copied,
    int redirected,
    List<String> failures,
    List<String> warnings
) {
    public BuildReport {
        failures = List.copyOf(failures);
        warnings = List.copyOf(warnings);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * The process exit status: zero on success, even with warnings, and one otherwise.
     */
    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }

    /**
     * A one-line summary of the pass.
     */
    public String summary() {
        return status.description + ": " + rendered + " rendered, " + skipped + " unchanged, " + excluded
            + " excluded, " + failed + " failed, " + copied + " assets copied, " + redirected + " redirects written, "
            + warnings.size() + " warnings";
    }

    public enum Status {
        SUCCESS("Build succeeded"),
        PARTIAL_FAILURE("Build finished with failures"),
        FAILED("Build failed"),
        ABORTED("Build aborted");

        Status(final String description) {
            this.description = description;
        }

        private final String description;
    }

    /**
     * Accumulates the outcome of a pass while documents are built concurrently.
     */
    static final class Collector {
        void rendered() {
            rendered.incrementAndGet();
        }

        void skipped() {
            skipped.incrementAndGet();
        }

        void excluded() {
            excluded.incrementAndGet();
        }

        void copied() {
            copied.incrementAndGet();
        }

        void redirected() {
            redirected.incrementAndGet();
        }

        void documents(final int count) {
            documents.set(count);
        }

        void documentFailed() {
            documentFailures.incrementAndGet();
        }

        void failure(final Condition condition) {
            failed.incrementAndGet();
            addMessage(failures, condition.detailedMessage());
        }

        void abort(final Condition condition) {
            addMessage(failures, condition.detailedMessage());
        }

        void warning(final Condition condition) {
            addMessage(warnings, condition.message());
        }

        BuildReport finish(final boolean completed) {
            final Status status;
            if (!completed) {
                status = Status.ABORTED;
            } else if (documents.get() > 0 && documentFailures.get() == documents.get()) {
                status = Status.FAILED;
            } else if (failed.get() > 0) {
                status = Status.PARTIAL_FAILURE;
            } else {
                status = Status.SUCCESS;
            }
            lock.lock();
            try {
                return new BuildReport(
                    status,
                    rendered.get(),
                    skipped.get(),
                    excluded.get(),
                    failed.get(),
                    copied.get(),
                    redirected.get(),
                    failures,
                    warnings
                );
            } finally {
                lock.unlock();
            }
        }

        private void addMessage(final List<String> messages, final String message) {
            lock.lock();
            try {
                messages.add(message);
            } finally {
                lock.unlock();
            }
        }

        private final AtomicInteger rendered = new AtomicInteger(0);
        private final AtomicInteger skipped = new AtomicInteger(0);
        private final AtomicInteger excluded = new AtomicInteger(0);
        private final AtomicInteger failed = new AtomicInteger(0);
        private final AtomicInteger copied = new AtomicInteger(0);
        private final AtomicInteger redirected = new AtomicInteger(0);
        private final AtomicInteger documents = new AtomicInteger(0);
        private final AtomicInteger documentFailures = new AtomicInteger(0);
        private final ReentrantLock lock = new ReentrantLock();
        private final List<String> failures = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
    }
}
