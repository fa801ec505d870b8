// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.cli;

import java.io.IOException;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;
import kiln.watch.LiveSession;

/**
 * The console of a live session: an empty line or {@code build} forces a pass, {@code quit} or the end of input ends
 * the session. An error reading the console unwinds to {@value #endSessionRestart}, which also ends it.
 */
final class Repl {
    Repl(final LiveSession session) {
        this.session = session;
    }

    void run() {
        while (true) {
            final var command = readCommand();
            switch (command) {
                case "", "build", "b" -> session.requestBuild();
                case "exit", "q", "quit" -> {
                    return;
                }
                default -> unknownCommand(command);
            }
        }
    }

    private static void unknownCommand(final String command) {
        try (final var streams = Streams.acquire()) {
            streams.out().println("Unknown command: " + command);
        }
    }

    private static String readCommand() {
        try (final var trace = new Trace("Reading a command")) {
            trace.use();
            final var result = ConditionContext.withRestart(endSessionRestart, restart -> {
                try {
                    final var line = Streams.input().readLine();
                    return (line != null) ? line.strip() : quitCommand;
                } catch (final IOException e) {
                    throw ConditionContext.error(new IOExceptionCondition(e));
                }
            });
            return (result != null) ? result : quitCommand;
        }
    }

    private final LiveSession session;

    static final String endSessionRestart = "end-session";
    private static final String quitCommand = "quit";
}
