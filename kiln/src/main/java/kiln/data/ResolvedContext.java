// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.nio.file.Path;
import kiln.source.SourceEntry;

/**
 * Everything decided about a document before it is rendered.
 *
 * @param document        The document.
 * @param data            The merged page data, with {@code title} filled in.
 * @param title           The document's title.
 * @param standalone      Whether the document is rendered without layouts.
 * @param draft           Whether the document is a draft, left out of release builds.
 * @param destination     The output path relative to the destination root.
 * @param dependencyStamp The newest modification time of the data fragments the document inherits.
 */
public record ResolvedContext(
    SourceEntry document,
    DataValue.Table data,
    String title,
    boolean standalone,
    boolean draft,
    Path destination,
    long dependencyStamp
) {
}
