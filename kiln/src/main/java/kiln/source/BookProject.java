// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.Path;
import kiln.util.PathUtils;

/**
 * A source subtree compiled by an external book compiler instead of the template engine.
 *
 * @param root         The absolute path of the subtree root.
 * @param relativeRoot The subtree root relative to the source root; also where the output is mounted.
 * @param marker       The absolute path of the {@code book.toml} marker.
 */
public record BookProject(Path root, Path relativeRoot, Path marker) {
    /**
     * The marker's path relative to the source root, the key the book is tracked under in the manifest.
     */
    public String key() {
        return PathUtils.toPortableString(relativeRoot.resolve(SourceConventions.bookMarkerFileName));
    }

    @Override
    public String toString() {
        return key();
    }
}
