// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.Path;
import java.util.Set;
import kiln.util.PathUtils;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides the {@link SourceKind} of a file from its path and the names of its siblings.
 * <p>
 * The rules are tried in order and the first match wins:
 * <ol>
 * <li>ignored paths (decided by {@link IgnoreRules} before the classifier is consulted);
 * <li>directories holding {@code book.toml}, see {@link #isBookDirectory(Set)};
 * <li>templates: partials in {@code templates/}, {@code layout.mustache}, and {@code layout.toml} next to a layout;
 * <li>documents: {@code *.md} and {@code *.html};
 * <li>data: {@code data.toml}, and {@code name.toml} next to a document {@code name.md} or {@code name.html};
 * <li>assets: everything else.
 * </ol>
 * Within {@code templates/} only partials are recognized; anything else there is ignored.
 */
public final class SourceClassifier {
    private SourceClassifier() {
    }

    /**
     * The outcome of classifying one file.
     *
     * @param kind      The kind picked by the first matching rule.
     * @param ambiguity If a later rule matched too, a description of the overlap; otherwise {@code null}.
     */
    public record Classification(SourceKind kind, @Nullable String ambiguity) {
        private static Classification of(final SourceKind kind) {
            return new Classification(kind, null);
        }
    }

    /**
     * Whether a directory with the given entries is the root of a book.
     */
    public static boolean isBookDirectory(final Set<String> entryNames) {
        return entryNames.contains(SourceConventions.bookMarkerFileName);
    }

    /**
     * Classifies a file.
     *
     * @param relativePath     The file's path relative to the source root.
     * @param siblingNames     The names of every entry in the file's directory, including the file itself.
     * @param insideTemplates  Whether the file lies beneath the templates directory.
     */
    public static Classification classify(
        final Path relativePath,
        final Set<String> siblingNames,
        final boolean insideTemplates
    ) {
        final var name = PathUtils.fileName(relativePath);
        final var extension = PathUtils.extension(relativePath);
        final var stem = PathUtils.stem(relativePath);

        if (insideTemplates) {
            return Classification.of(
                SourceConventions.templateExtension.equals(extension) ? SourceKind.TEMPLATE : SourceKind.IGNORED
            );
        }

        final var isLayout = SourceConventions.layoutFileName.equals(name);
        final var isLayoutConfig = SourceConventions.layoutConfigFileName.equals(name)
            && siblingNames.contains(SourceConventions.layoutFileName);
        final var isData = SourceConventions.dataFileName.equals(name)
            || (SourceConventions.fragmentExtension.equals(extension) && hasSiblingDocument(stem, siblingNames));

        if (isLayout || isLayoutConfig) {
            if (isData) {
                return new Classification(
                    SourceKind.TEMPLATE,
                    "both the configuration of " + SourceConventions.layoutFileName
                        + " and the data fragment of a document named " + stem + "; treated as layout configuration"
                );
            }
            return Classification.of(SourceKind.TEMPLATE);
        }
        if (isDocumentExtension(extension)) {
            return Classification.of(SourceKind.DOCUMENT);
        }
        if (isData) {
            return Classification.of(SourceKind.DATA);
        }
        return Classification.of(SourceKind.ASSET);
    }

    /**
     * Whether the extension (without the dot) is one of the document extensions.
     */
    public static boolean isDocumentExtension(final String extension) {
        return SourceConventions.markdownExtension.equals(extension)
            || SourceConventions.htmlExtension.equals(extension);
    }

    private static boolean hasSiblingDocument(final String stem, final Set<String> siblingNames) {
        return siblingNames.contains(stem + '.' + SourceConventions.markdownExtension)
            || siblingNames.contains(stem + '.' + SourceConventions.htmlExtension);
    }
}
