// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import kiln.util.PathUtils;

/**
 * The ignore patterns in effect for one directory of the source tree.
 * <p>
 * Patterns are globs. A pattern without a slash matches a file name at any depth below the directory that declared
 * it; a pattern with a slash is anchored to that directory. A trailing slash restricts the pattern to directories,
 * a leading {@code !} turns it into a force-include, and lines starting with {@code #} are comments. Patterns of
 * deeper {@code .kilnignore} files are consulted after shallower ones and the last matching pattern decides.
 * <p>
 * Hidden names, starting with a dot, are always ignored.
 */
public final class IgnoreRules {
    private IgnoreRules(final List<Rule> rules) {
        this.rules = rules;
    }

    /**
     * Creates the rules of the source root from the project-wide patterns.
     */
    public static IgnoreRules root(final List<String> patterns) {
        return new IgnoreRules(List.of()).child(Path.of(""), patterns);
    }

    /**
     * Returns these rules extended with the lines of an ignore file found in the given directory.
     */
    public IgnoreRules child(final Path relativeDirectory, final List<String> lines) {
        final var extended = new ArrayList<>(rules);
        for (final var rawLine : lines) {
            final var line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            extended.add(Rule.parse(relativeDirectory, line));
        }
        return (extended.size() == rules.size()) ? this : new IgnoreRules(List.copyOf(extended));
    }

    /**
     * Decides whether the given path, relative to the source root, is ignored.
     */
    public boolean isIgnored(final Path relativePath, final boolean isDirectory) {
        if (PathUtils.fileName(relativePath).startsWith(".")) {
            return true;
        }
        boolean ignored = false;
        for (final var rule : rules) {
            if (rule.matches(relativePath, isDirectory)) {
                ignored = !rule.negated;
            }
        }
        return ignored;
    }

    private final List<Rule> rules;

    private record Rule(Path base, PathMatcher matcher, boolean negated, boolean directoryOnly, boolean anchored) {
        private static Rule parse(final Path base, final String line) {
            var pattern = line;
            final var negated = pattern.startsWith("!");
            if (negated) {
                pattern = pattern.substring(1);
            }
            final var directoryOnly = pattern.endsWith("/");
            if (directoryOnly) {
                pattern = pattern.substring(0, pattern.length() - 1);
            }
            final var anchored = pattern.contains("/");
            if (pattern.startsWith("/")) {
                pattern = pattern.substring(1);
            }
            final var matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            return new Rule(base, matcher, negated, directoryOnly, anchored);
        }

        private boolean matches(final Path relativePath, final boolean isDirectory) {
            if (directoryOnly && !isDirectory) {
                return false;
            }
            if (!base.toString().isEmpty() && !relativePath.startsWith(base)) {
                return false;
            }
            final var local = base.toString().isEmpty() ? relativePath : base.relativize(relativePath);
            if (anchored) {
                return matcher.matches(local);
            }
            final var fileName = local.getFileName();
            return fileName != null && matcher.matches(fileName);
        }
    }
}
