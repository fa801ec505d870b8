// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition.exception;

import java.io.PrintWriter;
import java.io.StringWriter;
import kiln.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A condition wrapping a Java exception. The detailed message is the exception's stack trace.
 */
public abstract class ExceptionCondition<E extends Exception> extends Condition {
    ExceptionCondition(final @NotNull E exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    /**
     * Retrieves the wrapped exception.
     */
    public final @NotNull E exception() {
        return exception;
    }

    @Override
    public @NotNull String detailedMessage() {
        final var writer = new StringWriter();
        try (final var printWriter = new PrintWriter(writer)) {
            exception.printStackTrace(printWriter);
        }
        return writer.toString();
    }

    @Override
    public @NotNull String toString() {
        return getClass().getSimpleName() + ": " + exception;
    }

    private final @NotNull E exception;
}
