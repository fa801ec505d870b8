// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.manifest;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import kiln.config.BuildTag;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The record of what the previous passes of one tag produced, used to skip sources whose output is up to date.
 * <p>
 * Lookups and {@link #record(ManifestEntry)} are safe to call from several threads at once.
 */
public final class BuildManifest {
    /**
     * Initializes a manifest with the given entries.
     *
     * @param tag             The tag the manifest belongs to.
     * @param destinationRoot The destination root of that tag.
     * @param force           If set, every source is considered stale for this pass.
     * @param entries         The entries loaded from disk.
     */
    public BuildManifest(
        final BuildTag tag,
        final Path destinationRoot,
        final boolean force,
        final Collection<ManifestEntry> entries
    ) {
        this.tag = tag;
        this.destinationRoot = destinationRoot;
        this.force = force;
        for (final var entry : entries) {
            this.entries.put(entry.source(), entry);
        }
    }

    public BuildTag tag() {
        return tag;
    }

    public Path destinationRoot() {
        return destinationRoot;
    }

    /**
     * Decides whether a source has to be built again.
     * <p>
     * A source is stale if it was never built, if its modification time, dependency stamp or destination changed
     * since it was, or if its output has gone missing. Everything is stale in force mode.
     */
    public boolean isStale(final ManifestEntry candidate) {
        if (force) {
            return true;
        }
        final var previous = entries.get(candidate.source());
        if (previous == null || !previous.equals(candidate)) {
            return true;
        }
        return !Files.exists(resolve(candidate.destination()));
    }

    /**
     * Records a successfully built source, replacing its previous entry.
     */
    public void record(final ManifestEntry entry) {
        entries.put(entry.source(), entry);
    }

    /**
     * Finds a live source other than {@code excluded} whose output is the given destination or a directory
     * containing it, or returns {@code null} if there is none.
     */
    public @Nullable String claimant(final String destination, final Set<String> liveSources, final String excluded) {
        for (final var entry : entries.values()) {
            final var source = entry.source();
            if (source.equals(excluded) || !liveSources.contains(source)) {
                continue;
            }
            if (isClaimed(destination, Set.of(entry.destination()))) {
                return source;
            }
        }
        return null;
    }

    /**
     * Forgets every source not in the given set and deletes its output.
     * <p>
     * Output still claimed by a live source survives: nothing is deleted at or inside a live destination, and when a
     * removed book mount contains live destinations, only the rest of the mount is deleted.
     *
     * @return The removed entries, sorted by source.
     */
    public List<ManifestEntry> prune(final Set<String> liveSources) {
        try (final var trace = new Trace("Pruning outputs of deleted sources")) {
            trace.use();
            final var claimed = new HashSet<String>();
            final var removed = new ArrayList<ManifestEntry>();
            for (final var entry : entries.values()) {
                if (liveSources.contains(entry.source())) {
                    claimed.add(entry.destination());
                } else {
                    removed.add(entry);
                }
            }
            removed.sort(Comparator.comparing(ManifestEntry::source));
            for (final var entry : removed) {
                entries.remove(entry.source());
                if (!entry.destination().isEmpty() && !isClaimed(entry.destination(), claimed)) {
                    deleteOutput(entry, claimedBelow(entry.destination(), claimed));
                }
            }
            return removed;
        }
    }

    /**
     * Returns every entry, sorted by source.
     */
    public List<ManifestEntry> entries() {
        final var result = new ArrayList<>(entries.values());
        result.sort(Comparator.comparing(ManifestEntry::source));
        return result;
    }

    private static boolean isClaimed(final String destination, final Set<String> claimed) {
        if (claimed.contains(destination)) {
            return true;
        }
        for (final var live : claimed) {
            if (!live.isEmpty() && destination.startsWith(live + '/')) {
                return true;
            }
        }
        return false;
    }

    private Set<Path> claimedBelow(final String destination, final Set<String> claimed) {
        final var prefix = destination + '/';
        final var result = new HashSet<Path>();
        for (final var live : claimed) {
            if (live.startsWith(prefix)) {
                result.add(resolve(live));
            }
        }
        return result;
    }

    private void deleteOutput(final ManifestEntry entry, final Set<Path> kept) {
        final var output = resolve(entry.destination());
        try (final var trace = new Trace(() -> "Deleting stale output " + entry.destination())) {
            trace.use();
            if (kept.isEmpty()) {
                PathUtils.deleteRecursively(output);
                removeEmptyParents(output.getParent());
            } else {
                deleteAllExcept(output, kept);
            }
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private static void deleteAllExcept(final Path directory, final Set<Path> kept) throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attributes) {
                return kept.contains(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attributes)
                throws IOException {
                if (!kept.contains(file)) {
                    Files.delete(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final @Nullable IOException exception)
                throws IOException {
                if (exception != null) {
                    throw exception;
                }
                try (final var stream = Files.newDirectoryStream(dir)) {
                    if (!stream.iterator().hasNext()) {
                        Files.delete(dir);
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private Path resolve(final String destination) {
        return destinationRoot.resolve(PathUtils.fromPortableString(destination).toString());
    }

    private void removeEmptyParents(final @Nullable Path start) throws IOException {
        var directory = start;
        while (directory != null && !directory.equals(destinationRoot) && directory.startsWith(destinationRoot)) {
            try (final var stream = Files.newDirectoryStream(directory)) {
                if (stream.iterator().hasNext()) {
                    return;
                }
            }
            Files.delete(directory);
            directory = directory.getParent();
        }
    }

    private final BuildTag tag;
    private final Path destinationRoot;
    private final boolean force;
    private final ConcurrentHashMap<String, ManifestEntry> entries = new ConcurrentHashMap<>();
}
