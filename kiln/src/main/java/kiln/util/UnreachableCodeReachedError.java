// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util;

/**
 * Thrown when control reaches a point that should be impossible to reach.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Control reached a point believed to be unreachable");
    }

    public UnreachableCodeReachedError(final String message) {
        super(message);
    }
}
