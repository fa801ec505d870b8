// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.render;

import kiln.livereload.ReloadScript;

/**
 * Adds the live reload script to rendered pages.
 */
final class LiveReloadInjector {
    private LiveReloadInjector() {
    }

    /**
     * Inserts the script tag right before the last {@code </body>}, or appends it if there is none.
     */
    static String inject(final String html) {
        final var index = lastIndexOfIgnoreCase(html, bodyEnd);
        if (index == -1) {
            return html + scriptTag;
        }
        return html.substring(0, index) + scriptTag + html.substring(index);
    }

    private static int lastIndexOfIgnoreCase(final String haystack, final String needle) {
        for (int i = haystack.length() - needle.length(); i >= 0; i -= 1) {
            if (haystack.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    static final String scriptTag = "<script src=\"/" + ReloadScript.fileName + "\"></script>";
    private static final String bodyEnd = "</body>";
}
