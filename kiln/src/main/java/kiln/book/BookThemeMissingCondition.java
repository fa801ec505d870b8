// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.book;

import java.nio.file.Path;
import kiln.util.PathUtils;
import kiln.util.condition.Condition;

/**
 * A warning that the configured book theme directory does not exist. Books are built with the compiler's own
 * theme instead.
 */
public final class BookThemeMissingCondition extends Condition {
    BookThemeMissingCondition(final Path theme) {
        super("Book theme directory " + PathUtils.toPortableString(theme) + " does not exist; using the default theme");
    }
}
