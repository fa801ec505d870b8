// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.destination;

/**
 * How documents map to output files.
 */
public enum UrlPolicy {
    /** {@code blog/post.md} becomes {@code blog/post/index.html}, served as {@code /blog/post/}. */
    CLEAN,
    /** {@code blog/post.md} becomes {@code blog/post.html}. */
    EXTENSION;

    public static UrlPolicy of(final boolean cleanUrls) {
        return cleanUrls ? CLEAN : EXTENSION;
    }
}
