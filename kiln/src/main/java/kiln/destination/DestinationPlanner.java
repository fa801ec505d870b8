// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.destination;

import java.nio.file.Path;
import java.util.Set;
import kiln.source.SourceConventions;
import kiln.util.PathUtils;
import kiln.util.condition.ConditionContext;

/**
 * Maps source paths to output paths, relative to the source and destination roots respectively.
 * <p>
 * The planner knows every document of the pass, which it needs to resolve clean URL conflicts: when both
 * {@code about.md} and {@code about/index.md} exist, the latter owns {@code about/index.html} and the former is
 * demoted to {@code about.html}.
 */
public final class DestinationPlanner {
    /**
     * Initializes a planner for a pass with the given documents.
     *
     * @param documents     The relative paths of every document of the pass.
     * @param defaultPolicy The policy for documents that do not override it.
     */
    public DestinationPlanner(final Set<Path> documents, final UrlPolicy defaultPolicy) {
        this.documents = Set.copyOf(documents);
        this.defaultPolicy = defaultPolicy;
    }

    public UrlPolicy defaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Returns the output path of a document under the given policy.
     */
    public Path plan(final Path document, final UrlPolicy policy) {
        final var stem = PathUtils.stem(document);
        final var directory = PathUtils.parentOf(document);
        if (SourceConventions.indexStem.equals(stem)) {
            return directory.resolve(indexFileName);
        }
        final var flatName = stem + '.' + SourceConventions.htmlExtension;
        if (policy == UrlPolicy.EXTENSION || ownsIndex(directory.resolve(stem))) {
            return directory.resolve(flatName);
        }
        return directory.resolve(stem).resolve(indexFileName);
    }

    /**
     * Returns the output path of an asset, which is the source path itself.
     */
    public Path planAsset(final Path asset) {
        return asset;
    }

    /**
     * Signals a fatal {@link DestinationCollisionCondition} if the given document shares its output with another
     * document of the same directory and stem. The HTML document wins over the Markdown one.
     */
    public void checkCollision(final Path document) {
        if (!SourceConventions.markdownExtension.equals(PathUtils.extension(document))) {
            return;
        }
        final var rival = PathUtils.changeExtension(document, SourceConventions.htmlExtension);
        if (documents.contains(rival)) {
            throw ConditionContext.error(new DestinationCollisionCondition(document, rival));
        }
    }

    private boolean ownsIndex(final Path directory) {
        final var index = SourceConventions.indexStem + '.';
        return documents.contains(directory.resolve(index + SourceConventions.markdownExtension))
            || documents.contains(directory.resolve(index + SourceConventions.htmlExtension));
    }

    private static final String indexFileName = "index.html";

    private final Set<Path> documents;
    private final UrlPolicy defaultPolicy;
}
