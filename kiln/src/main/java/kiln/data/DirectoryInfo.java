// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.nio.file.Path;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What a single source directory contributes to the documents beneath it.
 *
 * @param relativeDirectory The directory, relative to the source root.
 * @param data              The directory's {@code data.toml}, if any.
 * @param layout            The directory's {@code layout.mustache} relative to the source root, if any.
 * @param layoutModified    The layout's modification time, or zero.
 * @param layoutConfig      The {@code layout.toml} next to the layout, if any.
 */
public record DirectoryInfo(
    Path relativeDirectory,
    @Nullable ConfigFragment data,
    @Nullable Path layout,
    long layoutModified,
    @Nullable ConfigFragment layoutConfig
) {
    /**
     * The newer of the layout's and its configuration's modification times.
     */
    public long layoutStamp() {
        return Math.max(layoutModified, (layoutConfig == null) ? 0 : layoutConfig.modified());
    }
}
