// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.cli;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.concurrent.locks.ReentrantLock;
import kiln.util.SneakyThrow;

/**
 * Exclusive access to the console, so that reports from build threads and the fallback handler's messages do not
 * interleave.
 * <p>
 * Standard input is read through {@link #input()} without holding the console, because live mode waits for
 * commands while build passes keep printing their reports.
 */
final class Streams implements AutoCloseable {
    // The corresponding unlock is in close().
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams() {
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    static Streams acquire() {
        return new Streams();
    }

    static BufferedReader input() {
        return Input.reader;
    }

    @Override
    public void close() {
        lock.unlock();
    }

    @SuppressWarnings({"MethodMayBeStatic", "UseOfSystemOutOrSystemErr"})
    PrintStream out() {
        return System.out;
    }

    @SuppressWarnings({"MethodMayBeStatic", "UseOfSystemOutOrSystemErr"})
    PrintStream err() {
        return System.err;
    }

    private static final ReentrantLock lock = new ReentrantLock();

    // Lazily initialized, most runs never read anything.
    private static final class Input {
        private static Charset charset() {
            final var console = System.console();
            return (console == null) ? Charset.defaultCharset() : console.charset();
        }

        private static final BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, charset()));
    }
}
