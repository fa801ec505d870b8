// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition;

/**
 * Warning reporting an exception that was thrown during cleanup and could not be propagated.
 * <p>
 * Never unwind in response to this condition.
 */
public final class SuppressedExceptionCondition extends Condition {
    SuppressedExceptionCondition(final Exception exception) {
        super("Suppressed exception: " + exception);
    }
}
