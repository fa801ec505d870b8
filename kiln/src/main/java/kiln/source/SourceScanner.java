// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import kiln.config.SiteSettings;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Walks the source root and classifies everything in it.
 */
public final class SourceScanner {
    public SourceScanner(final SiteSettings settings) {
        sourceRoot = settings.sourceDirectory();
        excludedDirectory = settings.targetDirectory().toAbsolutePath().normalize();
        followLinks = settings.followLinks();
        rootRules = IgnoreRules.root(settings.ignorePatterns());
    }

    /**
     * Scans the source tree.
     * <p>
     * Signals a fatal {@link SourceRootCondition} if the source root is not a directory, a fatal
     * {@link IOExceptionCondition} if walking the tree fails, and {@link ClassificationAmbiguousCondition} warnings.
     */
    public SourceTree scan() {
        try (final var trace = new Trace(() -> "Scanning the source tree " + sourceRoot)) {
            trace.use();
            if (!Files.isDirectory(sourceRoot)) {
                throw ConditionContext.error(new SourceRootCondition(sourceRoot));
            }
            final var visitor = new Visitor();
            try {
                final var options = followLinks
                    ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                    : EnumSet.noneOf(FileVisitOption.class);
                Files.walkFileTree(sourceRoot, options, Integer.MAX_VALUE, visitor);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            visitor.entries.sort(Comparator.comparing(SourceEntry::key));
            visitor.books.sort(Comparator.comparing(BookProject::key));
            return new SourceTree(sourceRoot, visitor.entries, visitor.books);
        }
    }

    private static Set<String> listNames(final Path directory) throws IOException {
        final var names = new HashSet<String>();
        try (final var stream = Files.newDirectoryStream(directory)) {
            for (final var path : stream) {
                names.add(PathUtils.fileName(path));
            }
        } catch (final DirectoryIteratorException e) {
            throw e.getCause();
        }
        return names;
    }

    private final Path sourceRoot;
    private final Path excludedDirectory;
    private final boolean followLinks;
    private final IgnoreRules rootRules;

    private final class Visitor extends SimpleFileVisitor<Path> {
        @Override
        public FileVisitResult preVisitDirectory(final Path directory, final BasicFileAttributes attributes)
            throws IOException {
            final var relativePath = sourceRoot.relativize(directory);
            final var isRoot = relativePath.toString().isEmpty();
            final var parent = directories.peek();
            final var parentRules = (parent == null) ? rootRules : parent.rules;
            if (!isRoot && parentRules.isIgnored(relativePath, true)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            if (directory.toAbsolutePath().normalize().equals(excludedDirectory)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            final var names = listNames(directory);
            if (SourceClassifier.isBookDirectory(names)) {
                books.add(new BookProject(
                    directory,
                    relativePath,
                    directory.resolve(SourceConventions.bookMarkerFileName)
                ));
                return FileVisitResult.SKIP_SUBTREE;
            }
            var rules = parentRules;
            if (names.contains(SourceConventions.ignoreFileName)) {
                final var ignoreFile = directory.resolve(SourceConventions.ignoreFileName);
                rules = rules.child(relativePath, Files.readAllLines(ignoreFile));
            }
            final var insideTemplates = !isRoot
                && relativePath.getName(0).toString().equals(SourceConventions.templatesDirectoryName);
            directories.push(new DirectoryState(rules, names, insideTemplates));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(final Path file, final BasicFileAttributes attributes) {
            final var state = directories.peek();
            assert state != null : "File visited outside of any directory";
            final var relativePath = sourceRoot.relativize(file);
            if (!attributes.isRegularFile() || state.rules.isIgnored(relativePath, false)) {
                return FileVisitResult.CONTINUE;
            }
            final var classification = SourceClassifier.classify(relativePath, state.names, state.insideTemplates);
            final var ambiguity = classification.ambiguity();
            if (ambiguity != null) {
                ConditionContext.signal(new ClassificationAmbiguousCondition(relativePath, ambiguity));
            }
            if (classification.kind() != SourceKind.IGNORED) {
                entries.add(new SourceEntry(
                    file,
                    relativePath,
                    classification.kind(),
                    attributes.lastModifiedTime().toMillis()
                ));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(final Path directory, final @Nullable IOException exception)
            throws IOException {
            if (exception != null) {
                throw exception;
            }
            directories.pop();
            return FileVisitResult.CONTINUE;
        }

        private final ArrayDeque<DirectoryState> directories = new ArrayDeque<>();
        private final List<SourceEntry> entries = new ArrayList<>();
        private final List<BookProject> books = new ArrayList<>();
    }

    private record DirectoryState(IgnoreRules rules, Set<String> names, boolean insideTemplates) {
    }
}
