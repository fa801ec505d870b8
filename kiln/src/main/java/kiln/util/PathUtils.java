// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Miscellaneous operations on paths.
 */
public final class PathUtils {
    private PathUtils() {
    }

    /**
     * Returns the file name of the path as a string, or the empty string for a path without one.
     */
    public static String fileName(final Path path) {
        final var fileName = path.getFileName();
        return (fileName == null) ? "" : fileName.toString();
    }

    /**
     * Returns the file name without its last extension: {@code about} for {@code blog/about.md}.
     */
    public static String stem(final Path path) {
        final var name = fileName(path);
        final var dotIndex = name.lastIndexOf('.');
        return (dotIndex <= 0) ? name : name.substring(0, dotIndex);
    }

    /**
     * Returns the last extension of the file name without the dot, or the empty string if there is none.
     */
    public static String extension(final Path path) {
        final var name = fileName(path);
        final var dotIndex = name.lastIndexOf('.');
        return (dotIndex <= 0) ? "" : name.substring(dotIndex + 1);
    }

    /**
     * Replaces the extension of the path's file name, appending one if the name has none.
     */
    public static Path changeExtension(final Path path, final String newExtension) {
        return resolveSibling(path, stem(path) + '.' + newExtension);
    }

    /**
     * Resolves a name against the parent of the given path, treating a relative single-component path as living in
     * the empty directory.
     */
    public static Path resolveSibling(final Path path, final String name) {
        final var parent = path.getParent();
        return (parent == null) ? path.getFileSystem().getPath(name) : parent.resolve(name);
    }

    /**
     * Returns the parent of a relative path, using the empty path for single-component paths.
     */
    public static Path parentOf(final Path relativePath) {
        final var parent = relativePath.getParent();
        return (parent == null) ? relativePath.getFileSystem().getPath("") : parent;
    }

    /**
     * Renders a relative path with forward slashes regardless of the platform separator.
     */
    public static String toPortableString(final Path relativePath) {
        final var builder = new StringBuilder();
        for (final var component : relativePath) {
            if (builder.length() > 0) {
                builder.append('/');
            }
            builder.append(component);
        }
        return builder.toString();
    }

    /**
     * Parses a forward-slash separated relative path produced by {@link #toPortableString(Path)}.
     */
    public static Path fromPortableString(final String string) {
        return string.isEmpty() ? Path.of("") : Path.of("", string.split("/"));
    }

    /**
     * Returns the newest modification time, in epoch milliseconds, of any regular file under the given directory,
     * skipping the subtree rooted at {@code excluded} if it is not null.
     */
    public static long newestModificationTime(final Path directory, final @Nullable Path excluded) throws IOException {
        final var newest = new long[]{0};
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attributes) {
                return dir.equals(excluded) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attributes) {
                newest[0] = Math.max(newest[0], attributes.lastModifiedTime().toMillis());
                return FileVisitResult.CONTINUE;
            }
        });
        return newest[0];
    }

    /**
     * Deletes the given file or directory tree. Does nothing if the path does not exist.
     */
    public static void deleteRecursively(final Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attributes)
                throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final @Nullable IOException exception)
                throws IOException {
                if (exception != null) {
                    throw exception;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Copies a directory tree into the target directory, replacing existing files.
     *
     * @return The number of files copied.
     */
    public static int copyTree(final Path source, final Path target) throws IOException {
        final var count = new int[]{0};
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attributes)
                throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attributes)
                throws IOException {
                Files.copy(
                    file,
                    target.resolve(source.relativize(file).toString()),
                    StandardCopyOption.REPLACE_EXISTING
                );
                count[0] += 1;
                return FileVisitResult.CONTINUE;
            }
        });
        return count[0];
    }
}
