// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import kiln.book.ProcessBookCompiler;
import kiln.compiler.BuildOptions;
import kiln.compiler.BuildReport;
import kiln.compiler.Compiler;
import kiln.config.BuildTag;
import kiln.config.SettingsLoader;
import kiln.util.SneakyThrow;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.Handler;
import kiln.util.condition.exception.IOExceptionCondition;
import kiln.watch.LiveSession;
import org.checkerframework.checker.nullness.qual.Nullable;

final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(mainImpl(args).value);
    }

    private static ExitCode mainImpl(final String[] args) {
        final var arguments = Arguments.parse(args);
        if (arguments == null) {
            try (final var streams = Streams.acquire()) {
                streams.err().println("Usage: kiln <project directory> [--release] [--force] [--live]");
                return ExitCode.USAGE;
            }
        }

        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            final var exitCode = ConditionContext.withRestart(abortProcessRestart, restart -> {
                final var settings = SettingsLoader.load(arguments.projectDirectory);
                final var threadPool = createThreadPool(settings.threads());
                try {
                    final var compiler =
                        new Compiler(arguments.projectDirectory, threadPool, new ProcessBookCompiler());
                    return arguments.live ? runLive(compiler, arguments) : runOnce(compiler, arguments);
                } finally {
                    shutDownThreadPool(threadPool);
                }
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static ExitCode runOnce(final Compiler compiler, final Arguments arguments) {
        final var report = compiler.compile(BuildOptions.of(arguments.tag(), arguments.force));
        printReport(report);
        return report.isSuccess() ? ExitCode.SUCCESS : ExitCode.ERROR;
    }

    private static ExitCode runLive(final Compiler compiler, final Arguments arguments) {
        final var settings = SettingsLoader.load(arguments.projectDirectory);
        try (final var session =
                 new LiveSession(compiler, settings, arguments.tag(), arguments.force, Main::printReport)) {
            session.start();
            new Repl(session).run();
            return ExitCode.SUCCESS;
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    static void printReport(final BuildReport report) {
        try (final var streams = Streams.acquire()) {
            final var err = streams.err();
            for (final var warning : report.warnings()) {
                err.println("warning: " + warning);
            }
            for (final var failure : report.failures()) {
                err.println("error: " + failure.stripTrailing());
            }
            streams.out().println(report.summary());
        }
    }

    private static ThreadPoolExecutor createThreadPool(final int threads) {
        final var threadId = new AtomicInteger(0);
        final var size = (threads > 0) ? threads : Runtime.getRuntime().availableProcessors();
        return new ThreadPoolExecutor(
            size,
            size,
            0,
            TimeUnit.NANOSECONDS,
            new LinkedBlockingQueue<>(),
            runnable -> new Thread(runnable, "worker-thread-" + threadId.addAndGet(1))
        );
    }

    @SuppressWarnings("ResultOfMethodCallIgnored")
    private static void shutDownThreadPool(final ExecutorService threadPool) {
        threadPool.shutdownNow();
        try {
            threadPool.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    static final String abortProcessRestart = "abort-process";

    private record Arguments(Path projectDirectory, boolean release, boolean force, boolean live) {
        private static @Nullable Arguments parse(final String[] args) {
            @Nullable Path projectDirectory = null;
            boolean release = false;
            boolean force = false;
            boolean live = false;
            for (final var argument : args) {
                switch (argument) {
                    case "--release" -> release = true;
                    case "--force" -> force = true;
                    case "--live" -> live = true;
                    default -> {
                        if (argument.startsWith("--") || projectDirectory != null) {
                            return null;
                        }
                        projectDirectory = Path.of(argument);
                    }
                }
            }
            return (projectDirectory != null) ? new Arguments(projectDirectory, release, force, live) : null;
        }

        private BuildTag tag() {
            return release ? BuildTag.RELEASE : BuildTag.DEBUG;
        }
    }

    private enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
