// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable carrying control to a {@link Restart}.
 * <p>
 * Only public so that methods can declare it. Code should neither throw nor catch it, except for passing it across
 * a thread boundary. It extends {@link Throwable} directly: it is neither a recoverable exception nor an error.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
