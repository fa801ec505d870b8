// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The result of scanning the source root: every classified entry in sorted order, plus the book subtrees.
 */
public record SourceTree(Path root, List<SourceEntry> entries, List<BookProject> books) {
    public SourceTree {
        entries = List.copyOf(entries);
        books = List.copyOf(books);
    }

    public List<SourceEntry> ofKind(final SourceKind kind) {
        return entries.stream().filter(entry -> entry.kind() == kind).toList();
    }

    public List<SourceEntry> documents() {
        return ofKind(SourceKind.DOCUMENT);
    }

    public List<SourceEntry> assets() {
        return ofKind(SourceKind.ASSET);
    }

    /**
     * Returns the relative paths of all documents, for destination planning.
     */
    public Set<Path> documentPaths() {
        final var result = new HashSet<Path>();
        for (final var entry : documents()) {
            result.add(entry.relativePath());
        }
        return result;
    }

    public @Nullable SourceEntry find(final Path relativePath) {
        for (final var entry : entries) {
            if (entry.relativePath().equals(relativePath)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Returns the newest modification time of any partial in the templates directory, or zero if there are none.
     */
    public long newestPartialModified() {
        final var templatesDirectory = Path.of(SourceConventions.templatesDirectoryName);
        long newest = 0;
        for (final var entry : entries) {
            if (entry.kind() == SourceKind.TEMPLATE && entry.relativePath().startsWith(templatesDirectory)) {
                newest = Math.max(newest, entry.modified());
            }
        }
        return newest;
    }
}
