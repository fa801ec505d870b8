// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import kiln.compiler.BuildOptions;
import kiln.compiler.BuildReport;
import kiln.compiler.Compiler;
import kiln.config.BuildTag;
import kiln.config.SiteSettings;
import kiln.livereload.ReloadCoordinator;
import kiln.livereload.ReloadEvent;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live mode: serves the destination tree, rebuilds when sources change, and tells the connected browsers about
 * every pass.
 * <p>
 * Each pass is announced with {@code start} and a "Building..." notification. A successful pass is followed by
 * {@code reload}; a failed one by an error notification carrying the build summary.
 */
public final class LiveSession implements AutoCloseable {
    /**
     * Prepares a session. Nothing is built or served until {@link #start()}.
     *
     * @param compiler The compiler to run passes with.
     * @param settings The project settings, for the destination root, the server address and the quiet period.
     * @param tag      The tag to build.
     * @param force    Whether the first pass rebuilds everything.
     * @param reporter Receives the report of every pass, on the thread that ran it.
     * @throws IOException If the destination root cannot be created.
     */
    public LiveSession(
        final Compiler compiler,
        final SiteSettings settings,
        final BuildTag tag,
        final boolean force,
        final Consumer<BuildReport> reporter
    ) throws IOException {
        this.compiler = compiler;
        this.settings = settings;
        this.tag = tag;
        this.reporter = reporter;
        forceNextPass.set(force);
        final var destinationRoot = settings.destinationDirectory(tag);
        Files.createDirectories(destinationRoot);
        coordinator = new ReloadCoordinator(destinationRoot);
        scheduler = new BuildScheduler(this::runPass, settings.debounce());
    }

    /**
     * Runs the first pass, then starts the server and the source watcher.
     *
     * @throws IOException If the source watcher cannot be set up.
     */
    public void start() throws IOException {
        runPass();
        coordinator.start(settings.liveHost(), settings.livePort());
        watcher = new SourceWatcher(settings, scheduler::request);
        logger.info("Watching {} for changes", settings.sourceDirectory());
    }

    /**
     * Asks for a pass, as if a source had changed.
     */
    public void requestBuild() {
        scheduler.request();
    }

    public ReloadCoordinator coordinator() {
        return coordinator;
    }

    /**
     * Runs one pass and tells the clients how it went.
     */
    public BuildReport runPass() {
        coordinator.broadcast(new ReloadEvent.Start());
        coordinator.broadcast(new ReloadEvent.Notify(buildingMessage, false));
        final var options = new BuildOptions(tag, forceNextPass.getAndSet(false), true, coordinator.endpoint());
        final var report = compiler.compile(options);
        if (report.isSuccess()) {
            coordinator.broadcast(new ReloadEvent.Reload(null));
        } else {
            final var message = new StringBuilder(report.summary());
            for (final var failure : report.failures()) {
                message.append('\n').append(failure);
            }
            coordinator.broadcast(new ReloadEvent.Notify(message.toString(), true));
        }
        reporter.accept(report);
        return report;
    }

    @Override
    public void close() throws IOException {
        final var currentWatcher = watcher;
        if (currentWatcher != null) {
            currentWatcher.close();
        }
        scheduler.close();
        coordinator.close();
    }

    private final Compiler compiler;
    private final SiteSettings settings;
    private final BuildTag tag;
    private final Consumer<BuildReport> reporter;
    private final AtomicBoolean forceNextPass = new AtomicBoolean(false);
    private final ReloadCoordinator coordinator;
    private final BuildScheduler scheduler;
    private @Nullable SourceWatcher watcher = null;

    static final String buildingMessage = "Building...";
    private static final Logger logger = LoggerFactory.getLogger(LiveSession.class);
}
