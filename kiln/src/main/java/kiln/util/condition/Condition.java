// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Base type of everything that can be signaled through a {@link ConditionContext}.
 * <p>
 * A condition describes something a caller several frames up may want to react to: a malformed data fragment,
 * a template that failed to compile, a file that could not be written. Handlers see the condition while the frames
 * that signaled it are still live, so they can pick any restart established below them.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given short, user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the short user-readable message, suitable for a single line of a build report.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable message, possibly spanning multiple lines.
     * <p>
     * Subclasses that carry more context than fits in {@link #message()} override this.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + ": " + message;
    }

    private final @NotNull String message;
}
