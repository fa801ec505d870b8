// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.cli;

import java.util.List;
import java.util.Set;
import kiln.util.Trace;
import kiln.util.condition.Condition;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.HandlerProcedure;
import kiln.util.condition.Restart;
import kiln.util.condition.SignaledCondition;
import kiln.util.condition.SuppressedExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outermost handler, for conditions that escape a build pass: failing to load the settings before the first
 * pass, failing to start the live server, losing standard input.
 * <p>
 * A fatal condition is printed with the operation trace, then the handler unwinds to the newest command-level
 * restart, which ends the live session or the whole process. Suppressed exceptions are printed and declined;
 * other warnings are left to the build report.
 */
final class FallbackHandler implements HandlerProcedure.ThreadSafe {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            if (condition.condition() instanceof SuppressedExceptionCondition) {
                print(describe("warning", condition.condition(), Trace.activeTraces()));
            }
            return;
        }
        print(describe("error", condition.condition(), Trace.activeTraces()));
        final var restart = commandRestart();
        if (restart != null) {
            restart.unwindTo();
        }
    }

    /**
     * Finds the newest restart that ends a live session or the process, or {@code null} if there is none.
     */
    static @Nullable Restart commandRestart() {
        for (final var restart : ConditionContext.restarts()) {
            if (commandRestarts.contains(restart.name())) {
                return restart;
            }
        }
        return null;
    }

    static String describe(final String severity, final Condition condition, final List<String> traces) {
        final var builder = new StringBuilder();
        builder.append(severity).append(": ").append(condition.detailedMessage().stripTrailing()).append('\n');
        for (final var trace : traces) {
            builder.append("  - ").append(trace).append('\n');
        }
        return builder.toString();
    }

    private static void print(final String text) {
        try (final var streams = Streams.acquire()) {
            streams.err().print(text);
            streams.err().flush();
        }
    }

    private static final FallbackHandler instance = new FallbackHandler();
    private static final Set<String> commandRestarts = Set.of(Main.abortProcessRestart, Repl.endSessionRestart);
}
