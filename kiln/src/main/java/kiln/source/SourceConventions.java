// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

/**
 * File and directory names with a special meaning in the source tree.
 */
public final class SourceConventions {
    private SourceConventions() {
    }

    public static final String templatesDirectoryName = "templates";
    public static final String layoutFileName = "layout.mustache";
    public static final String layoutConfigFileName = "layout.toml";
    public static final String dataFileName = "data.toml";
    public static final String bookMarkerFileName = "book.toml";
    public static final String ignoreFileName = ".kilnignore";
    public static final String indexStem = "index";
    public static final String markdownExtension = "md";
    public static final String htmlExtension = "html";
    public static final String templateExtension = "mustache";
    public static final String fragmentExtension = "toml";
}
