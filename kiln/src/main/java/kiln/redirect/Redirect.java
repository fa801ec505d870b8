// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.redirect;

import java.nio.file.Path;

/**
 * One entry of the {@code [redirect]} table.
 *
 * @param from        The old URL path, as written in the table.
 * @param to          The location the old path now lives at.
 * @param destination The redirect page, relative to the destination root.
 */
public record Redirect(String from, String to, Path destination) {
    /**
     * The key the redirect is tracked under in the build manifest.
     */
    public String manifestKey() {
        return manifestKeyPrefix + from;
    }

    private static final String manifestKeyPrefix = "redirect:";
}
