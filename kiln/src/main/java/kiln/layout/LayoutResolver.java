// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.layout;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import kiln.data.DataResolver;
import kiln.data.DataValue;
import kiln.data.DirectoryCache;
import kiln.data.DirectoryInfo;
import kiln.data.ResolvedContext;
import kiln.source.SourceClassifier;
import kiln.source.SourceConventions;
import kiln.source.SourceKind;
import kiln.source.SourceTree;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the layouts a document is wrapped in.
 * <p>
 * Without an explicit {@code layout} key the nearest {@code layout.mustache} at or above the document's directory is
 * used. A layout whose {@code layout.toml} says {@code extends = true} is itself wrapped in the next layout above
 * it, and so on, until a layout without that flag or the source root is reached.
 */
public final class LayoutResolver {
    public LayoutResolver(final SourceTree tree, final DirectoryCache cache) {
        this.tree = tree;
        this.cache = cache;
    }

    /**
     * Resolves the layout chain of a document.
     * <p>
     * Signals a fatal {@link LayoutValidationCondition} for an unusable explicit layout, and a fatal
     * {@link kiln.data.MalformedFragmentCondition} for a broken {@code layout.toml} in the chain.
     */
    public LayoutChain resolve(final ResolvedContext context) {
        if (context.standalone()) {
            return LayoutChain.empty();
        }
        final var document = context.document();
        try (final var trace = new Trace(() -> "Resolving layouts of " + document)) {
            trace.use();
            final var layouts = new ArrayList<LayoutTemplate>();
            final var explicit = context.data().get(DataResolver.layoutKey);
            @Nullable Path searchFrom;
            if (explicit != null) {
                final var layout = validateExplicit(document.relativePath(), explicit);
                final var parent = PathUtils.parentOf(layout);
                if (isDirectoryLayout(layout)) {
                    final var info = cache.get(parent);
                    layouts.add(new LayoutTemplate(layout, info.layoutStamp()));
                    searchFrom = extendsParent(document.relativePath(), info) ? parentDirectory(parent) : null;
                } else {
                    final var entry = tree.find(layout);
                    layouts.add(new LayoutTemplate(layout, (entry == null) ? 0 : entry.modified()));
                    searchFrom = null;
                }
            } else {
                searchFrom = document.relativeDirectory();
            }
            walk(document.relativePath(), searchFrom, layouts);
            return new LayoutChain(layouts);
        }
    }

    private void walk(final Path document, final @Nullable Path start, final List<LayoutTemplate> layouts) {
        var directory = start;
        while (directory != null) {
            final var info = nearestLayout(directory);
            if (info == null) {
                return;
            }
            final var layout = info.layout();
            assert layout != null;
            layouts.add(new LayoutTemplate(layout, info.layoutStamp()));
            if (!extendsParent(document, info)) {
                return;
            }
            directory = parentDirectory(info.relativeDirectory());
        }
    }

    private @Nullable DirectoryInfo nearestLayout(final Path start) {
        final var chain = cache.chain(start);
        for (int i = chain.size() - 1; i >= 0; i -= 1) {
            final var info = chain.get(i);
            if (info.layout() != null) {
                return info;
            }
        }
        return null;
    }

    private static boolean extendsParent(final Path document, final DirectoryInfo info) {
        final var config = info.layoutConfig();
        if (config == null) {
            return false;
        }
        final var value = config.tableFor(document).get(extendsKey);
        return value instanceof final DataValue.Bool bool && bool.value();
    }

    private Path validateExplicit(final Path document, final DataValue value) {
        if (!(value instanceof final DataValue.Text text)) {
            throw ConditionContext.error(new LayoutValidationCondition(
                document,
                "the layout key must be a path, found a " + value.typeName()
            ));
        }
        final var layout = Path.of(text.value()).normalize();
        if (layout.isAbsolute() || layout.startsWith("..") || layout.toString().isEmpty()) {
            throw ConditionContext.error(new LayoutValidationCondition(
                document,
                text.value() + " is not a path inside the source root"
            ));
        }
        if (SourceClassifier.isDocumentExtension(PathUtils.extension(layout))) {
            throw ConditionContext.error(new LayoutValidationCondition(
                document,
                text.value() + " is a document, documents cannot be used as layouts"
            ));
        }
        final var entry = tree.find(layout);
        if (entry == null) {
            throw ConditionContext.error(new LayoutValidationCondition(document, text.value() + " does not exist"));
        }
        if (entry.kind() != SourceKind.TEMPLATE
            || !SourceConventions.templateExtension.equals(PathUtils.extension(layout))) {
            throw ConditionContext.error(new LayoutValidationCondition(
                document,
                text.value() + " is not a template; layouts are " + SourceConventions.layoutFileName
                    + " files or templates in " + SourceConventions.templatesDirectoryName + "/"
            ));
        }
        return layout;
    }

    private static boolean isDirectoryLayout(final Path layout) {
        return SourceConventions.layoutFileName.equals(PathUtils.fileName(layout));
    }

    private static @Nullable Path parentDirectory(final Path directory) {
        return directory.toString().isEmpty() ? null : PathUtils.parentOf(directory);
    }

    static final String extendsKey = "extends";

    private final SourceTree tree;
    private final DirectoryCache cache;
}
