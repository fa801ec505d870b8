// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import kiln.source.SourceConventions;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;

/**
 * Per-pass cache of {@link DirectoryInfo}, shared by every worker thread.
 * <p>
 * Each directory is read exactly once per pass, however many documents beneath it are being rendered concurrently.
 * Parse failures are cached like successes.
 */
public final class DirectoryCache {
    public DirectoryCache(final Path sourceRoot) {
        this.sourceRoot = sourceRoot;
    }

    /**
     * Returns the information of the given directory, relative to the source root, loading it if needed.
     * <p>
     * Signals a fatal {@link IOExceptionCondition} if the directory's layout exists but cannot be examined.
     */
    public DirectoryInfo get(final Path relativeDirectory) {
        return cache.computeIfAbsent(relativeDirectory, this::load);
    }

    /**
     * Returns the information of the given directory and all its ancestors, source root first.
     */
    public List<DirectoryInfo> chain(final Path relativeDirectory) {
        final var directories = new ArrayList<Path>();
        directories.add(Path.of(""));
        var current = Path.of("");
        for (final var component : relativeDirectory) {
            if (component.toString().isEmpty()) {
                continue;
            }
            current = current.resolve(component);
            directories.add(current);
        }
        final var result = new ArrayList<DirectoryInfo>(directories.size());
        for (final var directory : directories) {
            result.add(get(directory));
        }
        return result;
    }

    private DirectoryInfo load(final Path relativeDirectory) {
        try (final var trace = new Trace(() -> "Loading directory data of /" + relativeDirectory)) {
            trace.use();
            final var data = FragmentLoader.loadIfExists(
                sourceRoot,
                relativeDirectory.resolve(SourceConventions.dataFileName)
            );
            final var layoutPath = relativeDirectory.resolve(SourceConventions.layoutFileName);
            final BasicFileAttributes layoutAttributes;
            try {
                layoutAttributes = Files.readAttributes(sourceRoot.resolve(layoutPath), BasicFileAttributes.class);
            } catch (final NoSuchFileException e) {
                return new DirectoryInfo(relativeDirectory, data, null, 0, null);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            if (!layoutAttributes.isRegularFile()) {
                return new DirectoryInfo(relativeDirectory, data, null, 0, null);
            }
            final var layoutConfig = FragmentLoader.loadIfExists(
                sourceRoot,
                relativeDirectory.resolve(SourceConventions.layoutConfigFileName)
            );
            return new DirectoryInfo(
                relativeDirectory,
                data,
                layoutPath,
                layoutAttributes.lastModifiedTime().toMillis(),
                layoutConfig
            );
        }
    }

    private final Path sourceRoot;
    private final ConcurrentHashMap<Path, DirectoryInfo> cache = new ConcurrentHashMap<>();
}
