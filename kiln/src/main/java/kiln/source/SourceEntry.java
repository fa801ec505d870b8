// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.Path;
import kiln.util.PathUtils;

/**
 * A classified file of the source tree, as seen at the start of a build pass.
 *
 * @param absolutePath The path of the file on disk.
 * @param relativePath The path relative to the source root.
 * @param kind         The classification.
 * @param modified     The modification time in epoch milliseconds.
 */
public record SourceEntry(Path absolutePath, Path relativePath, SourceKind kind, long modified) {
    public boolean isMarkdown() {
        return SourceConventions.markdownExtension.equals(PathUtils.extension(relativePath));
    }

    public boolean isIndex() {
        return SourceConventions.indexStem.equals(PathUtils.stem(relativePath));
    }

    public String stem() {
        return PathUtils.stem(relativePath);
    }

    /**
     * The directory containing the entry, relative to the source root; empty for top-level files.
     */
    public Path relativeDirectory() {
        return PathUtils.parentOf(relativePath);
    }

    /**
     * The relative path with forward slashes, as used in manifests and reports.
     */
    public String key() {
        return PathUtils.toPortableString(relativePath);
    }

    @Override
    public String toString() {
        return key();
    }
}
