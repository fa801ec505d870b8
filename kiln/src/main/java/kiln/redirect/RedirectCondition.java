// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.redirect;

import kiln.util.condition.Condition;

/**
 * A condition type indicating that the {@code [redirect]} table is unusable: a malformed path or target, a cycle, or
 * a chain of redirects that is too long. Always fatal for the whole build.
 */
public final class RedirectCondition extends Condition {
    RedirectCondition(final String message) {
        super(message);
    }
}
