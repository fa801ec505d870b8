// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.compiler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import kiln.book.BookCompiler;
import kiln.book.BookDelegate;
import kiln.config.SettingsLoader;
import kiln.config.SiteSettings;
import kiln.data.DataResolver;
import kiln.data.DirectoryCache;
import kiln.data.DocumentText;
import kiln.destination.DestinationPlanner;
import kiln.destination.UrlPolicy;
import kiln.layout.LayoutResolver;
import kiln.livereload.ReloadScript;
import kiln.manifest.BuildManifest;
import kiln.manifest.ManifestEntry;
import kiln.manifest.ManifestStore;
import kiln.redirect.Redirect;
import kiln.redirect.RedirectPlanner;
import kiln.redirect.RedirectWriter;
import kiln.render.LiveReleaseCondition;
import kiln.render.Renderer;
import kiln.render.TemplateEngine;
import kiln.source.SourceEntry;
import kiln.source.SourceScanner;
import kiln.source.SourceTree;
import kiln.util.CollectionExecutorService;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.Handler;
import kiln.util.condition.exception.IOExceptionCondition;

/**
 * The entry point to a build pass.
 * <p>
 * A pass loads the project settings, scans the source tree, renders the stale documents in parallel, copies the
 * stale assets, delegates the stale books, writes the redirect pages, prunes the outputs of sources that are gone,
 * and finally saves the manifest. Every document, asset, book and redirect is built inside its own
 * {@value #skipDocumentRestart} restart, so one broken source only fails itself; conditions that make the whole
 * pass meaningless unwind to {@value #abortBuildRestart} instead, and the manifest is then left as it was.
 */
public final class Compiler {
    /**
     * Initializes a compiler for the project in the given directory, running parallel work on the given executor
     * service and delegating books to the given book compiler.
     */
    public Compiler(
        final Path projectDirectory,
        final ExecutorService executorService,
        final BookCompiler bookCompiler
    ) {
        this.projectDirectory = projectDirectory;
        executor = new CollectionExecutorService(executorService);
        this.bookCompiler = bookCompiler;
    }

    /**
     * Runs one build pass. Conditions signaled by the pass are recorded in the returned report rather than left to
     * the caller's handlers, except that warnings are still passed on after being recorded.
     */
    public BuildReport compile(final BuildOptions options) {
        final var collector = new BuildReport.Collector();
        try (final var handler = new Handler(new BuildConditionHandler(collector))) {
            handler.use();
            final var completed = ConditionContext.withRestart(abortBuildRestart, restart -> {
                new Pass(options, collector).run();
                return Boolean.TRUE;
            });
            return collector.finish(completed != null);
        }
    }

    private static void writeOutput(final Path target, final byte[] output) {
        try (final var trace = new Trace(() -> "Writing " + target)) {
            trace.use();
            Files.createDirectories(target.getParent());
            Files.write(target, output);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private static void ensureDirectoryExists(final Path directory) {
        try (final var trace = new Trace(() -> "Creating the destination root " + directory)) {
            trace.use();
            Files.createDirectories(directory);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private final Path projectDirectory;
    private final CollectionExecutorService executor;
    private final BookCompiler bookCompiler;

    public static final String skipDocumentRestart = "skip-document";
    public static final String abortBuildRestart = "abort-build";

    private final class Pass {
        private Pass(final BuildOptions options, final BuildReport.Collector collector) {
            this.options = options;
            this.collector = collector;
        }

        private void run() {
            try (final var trace = new Trace(() -> "Building " + projectDirectory + " for " + options.tag())) {
                trace.use();
                final var settings = SettingsLoader.load(projectDirectory);
                final var redirects = RedirectPlanner.plan(settings.redirects());
                if (options.live() && options.tag().isRelease()) {
                    ConditionContext.signal(new LiveReleaseCondition());
                }
                final var tree = new SourceScanner(settings).scan();
                final var destinationRoot = settings.destinationDirectory(options.tag());
                ensureDirectoryExists(destinationRoot);
                // Pages rendered with and without the reload script differ, so switching modes rebuilds everything.
                final var modeChanged = options.live() != Files.exists(destinationRoot.resolve(ReloadScript.fileName));
                final var manifest = ManifestStore.load(destinationRoot, options.tag(), options.force() || modeChanged);

                final var planner = new DestinationPlanner(tree.documentPaths(), UrlPolicy.of(settings.cleanUrls()));
                buildDocuments(settings, tree, planner, manifest);
                copyAssets(tree, planner, manifest);
                buildBooks(settings, tree, manifest);
                writeRedirects(redirects, manifest);

                manifest.prune(liveSources);
                ManifestStore.save(manifest);
                final var endpoint = options.liveReloadEndpoint();
                if (options.live() && endpoint != null) {
                    ReloadScript.write(destinationRoot, endpoint);
                } else {
                    ReloadScript.remove(destinationRoot);
                }
            }
        }

        private void buildDocuments(
            final SiteSettings settings,
            final SourceTree tree,
            final DestinationPlanner planner,
            final BuildManifest manifest
        ) {
            final var documents = tree.documents();
            collector.documents(documents.size());
            final var cache = new DirectoryCache(settings.sourceDirectory());
            final var dataResolver = new DataResolver(settings, cache, planner);
            final var layoutResolver = new LayoutResolver(tree, cache);
            final var renderer = new Renderer(
                new TemplateEngine(settings.sourceDirectory()),
                options.tag(),
                options.live()
            );
            final var sharedStamp = Math.max(tree.newestPartialModified(), settingsModified());
            executor.forEach(documents, document -> {
                liveSources.add(document.key());
                final var result = ConditionContext.withRestart(skipDocumentRestart, restart -> {
                    buildDocument(document, manifest, dataResolver, layoutResolver, renderer, sharedStamp);
                    return Boolean.TRUE;
                });
                if (result == null) {
                    collector.documentFailed();
                }
            });
        }

        private void buildDocument(
            final SourceEntry document,
            final BuildManifest manifest,
            final DataResolver dataResolver,
            final LayoutResolver layoutResolver,
            final Renderer renderer,
            final long sharedStamp
        ) {
            try (final var trace = new Trace(() -> "Building document " + document)) {
                trace.use();
                final var text = DocumentText.read(document);
                final var context = dataResolver.resolve(document, text);
                if (context.draft() && options.tag().isRelease()) {
                    liveSources.remove(document.key());
                    collector.excluded();
                    return;
                }
                final var chain = layoutResolver.resolve(context);
                final var entry = new ManifestEntry(
                    document.key(),
                    document.modified(),
                    PathUtils.toPortableString(context.destination()),
                    Math.max(sharedStamp, Math.max(context.dependencyStamp(), chain.stamp()))
                );
                if (!manifest.isStale(entry)) {
                    collector.skipped();
                    return;
                }
                final var output = renderer.render(context, chain, text);
                writeOutput(manifest.destinationRoot().resolve(context.destination().toString()), output);
                manifest.record(entry);
                collector.rendered();
            }
        }

        private void copyAssets(final SourceTree tree, final DestinationPlanner planner, final BuildManifest manifest) {
            executor.forEach(tree.assets(), asset -> {
                liveSources.add(asset.key());
                ConditionContext.withRestart(skipDocumentRestart, restart -> {
                    copyAsset(asset, planner.planAsset(asset.relativePath()), manifest);
                    return Boolean.TRUE;
                });
            });
        }

        private void copyAsset(final SourceEntry asset, final Path destination, final BuildManifest manifest) {
            try (final var trace = new Trace(() -> "Copying asset " + asset)) {
                trace.use();
                final var entry = new ManifestEntry(
                    asset.key(),
                    asset.modified(),
                    PathUtils.toPortableString(destination),
                    0
                );
                if (!manifest.isStale(entry)) {
                    return;
                }
                final var target = manifest.destinationRoot().resolve(destination.toString());
                try {
                    Files.createDirectories(target.getParent());
                    Files.copy(asset.absolutePath(), target, StandardCopyOption.REPLACE_EXISTING);
                } catch (final IOException e) {
                    throw ConditionContext.error(new IOExceptionCondition(e));
                }
                manifest.record(entry);
                collector.copied();
            }
        }

        private void buildBooks(final SiteSettings settings, final SourceTree tree, final BuildManifest manifest) {
            final var delegate = new BookDelegate(
                settings,
                manifest,
                bookCompiler,
                options.live() ? ('/' + options.liveReloadEndpoint()) : null
            );
            executor.forEach(tree.books(), book -> {
                liveSources.add(book.key());
                final var output = ConditionContext.withRestart(skipDocumentRestart, restart -> delegate.build(book));
                if (output == null) {
                    return;
                }
                switch (output.status()) {
                    case BUILT:
                        collector.rendered();
                        break;
                    case UP_TO_DATE:
                        collector.skipped();
                        break;
                    case EXCLUDED:
                        liveSources.remove(book.key());
                        collector.excluded();
                        break;
                }
            });
        }

        private void writeRedirects(final List<Redirect> redirects, final BuildManifest manifest) {
            final var writer = new RedirectWriter(manifest, settingsModified());
            // Runs once every other output of the pass is recorded.
            for (final var redirect : redirects) {
                liveSources.add(redirect.manifestKey());
                final var written = ConditionContext.withRestart(
                    skipDocumentRestart,
                    restart -> writer.write(redirect, liveSources)
                );
                if (Boolean.TRUE.equals(written)) {
                    collector.redirected();
                }
            }
        }

        private long settingsModified() {
            final var settingsFile = projectDirectory.resolve(SiteSettings.settingsFileName);
            try {
                return Files.exists(settingsFile) ? Files.getLastModifiedTime(settingsFile).toMillis() : 0;
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }

        private final BuildOptions options;
        private final BuildReport.Collector collector;
        private final Set<String> liveSources = ConcurrentHashMap.newKeySet();
    }
}
