// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.book;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import kiln.config.SiteSettings;
import kiln.data.DataValue;
import kiln.data.FragmentLoader;
import kiln.data.NonBooleanFlagCondition;
import kiln.manifest.BuildManifest;
import kiln.manifest.ManifestEntry;
import kiln.source.BookProject;
import kiln.source.SourceConventions;
import kiln.source.SourceReadCondition;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds book subtrees through a {@link BookCompiler} and mounts their output in the destination tree.
 * <p>
 * A book is tracked in the manifest under its {@code book.toml}, with the newest modification time of any file in
 * its subtree as the source stamp and the newest modification time in the theme directory as the dependency stamp.
 * The compiler writes into a scratch directory that is then copied over the book's mount point, so a failing
 * compiler never leaves half a book in the destination.
 * <p>
 * Thread-safe: books may be built concurrently.
 */
public final class BookDelegate {
    public BookDelegate(
        final SiteSettings settings,
        final BuildManifest manifest,
        final BookCompiler compiler,
        final @Nullable String liveReloadEndpoint
    ) {
        this.settings = settings;
        this.manifest = manifest;
        this.compiler = compiler;
        this.liveReloadEndpoint = liveReloadEndpoint;
    }

    /**
     * Builds the given book if it is stale.
     * <p>
     * Signals a fatal {@link BookCompilerFailedCondition} if the compiler fails, a fatal
     * {@link kiln.data.MalformedFragmentCondition} if {@code book.toml} is not valid TOML, a fatal
     * {@link SourceReadCondition} if the subtree cannot be read, and a fatal
     * {@link IOExceptionCondition} if the output cannot be copied into the destination.
     */
    public BookOutput build(final BookProject project) {
        try (final var trace = new Trace(() -> "Building book " + project)) {
            trace.use();
            final var marker = project.relativeRoot().resolve(SourceConventions.bookMarkerFileName);
            if (manifest.tag().isRelease() && isDraft(marker)) {
                return new BookOutput(project, BookOutput.Status.EXCLUDED, 0);
            }

            final var theme = themeDirectory();
            final var entry = new ManifestEntry(
                project.key(),
                newestModificationTime(marker, project.root(), project.root().resolve(manualBuildDirectoryName)),
                PathUtils.toPortableString(project.relativeRoot()),
                (theme != null) ? newestModificationTime(marker, theme, null) : 0
            );
            if (!manifest.isStale(entry)) {
                return new BookOutput(project, BookOutput.Status.UP_TO_DATE, 0);
            }

            final var copied = compileAndMount(project, theme);
            manifest.record(entry);
            return new BookOutput(project, BookOutput.Status.BUILT, copied);
        }
    }

    private int compileAndMount(final BookProject project, final @Nullable Path theme) {
        final Path scratch;
        try {
            scratch = Files.createTempDirectory(scratchPrefix);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        try {
            compiler.compile(new BookRequest(project, scratch, settings.bookCommand(), theme, liveReloadEndpoint));
            try (final var trace = new Trace(() -> "Copying the output of book " + project)) {
                trace.use();
                final var mountPoint = manifest.destinationRoot().resolve(project.relativeRoot().toString());
                if (!project.relativeRoot().toString().isEmpty()) {
                    PathUtils.deleteRecursively(mountPoint);
                }
                return PathUtils.copyTree(scratch, mountPoint);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        } finally {
            try {
                PathUtils.deleteRecursively(scratch);
            } catch (final IOException e) {
                ConditionContext.signalSuppressedException(e);
            }
        }
    }

    private boolean isDraft(final Path marker) {
        final var fragment = FragmentLoader.loadIfExists(settings.sourceDirectory(), marker);
        if (fragment == null) {
            return false;
        }
        final var site = fragment.tableFor(marker).get(siteSection);
        if (!(site instanceof final DataValue.Table siteTable)) {
            return false;
        }
        final var draft = siteTable.get(draftKey);
        if (draft == null) {
            return false;
        }
        if (draft instanceof final DataValue.Bool bool) {
            return bool.value();
        }
        ConditionContext.signal(new NonBooleanFlagCondition(marker, siteSection + '.' + draftKey, draft));
        return false;
    }

    private @Nullable Path themeDirectory() {
        final var theme = settings.sourceDirectory().resolve(settings.bookTheme());
        if (Files.isDirectory(theme)) {
            return theme;
        }
        if (settings.bookThemeExplicit()) {
            ConditionContext.signal(new BookThemeMissingCondition(settings.bookTheme()));
        }
        return null;
    }

    private static long newestModificationTime(
        final Path marker,
        final Path directory,
        final @Nullable Path excluded
    ) {
        try {
            return PathUtils.newestModificationTime(directory, excluded);
        } catch (final IOException e) {
            throw ConditionContext.error(new SourceReadCondition(marker, e));
        }
    }

    private final SiteSettings settings;
    private final BuildManifest manifest;
    private final BookCompiler compiler;
    private final @Nullable String liveReloadEndpoint;

    private static final String siteSection = "site";
    private static final String draftKey = "draft";
    private static final String scratchPrefix = "kiln-book-";
    // mdBook's default build directory, left over from running it by hand.
    private static final String manualBuildDirectoryName = "book";
}
