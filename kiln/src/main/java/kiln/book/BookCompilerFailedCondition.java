// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.book;

import java.nio.file.Path;
import kiln.source.SourceCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition type indicating that the external book compiler could not be run or reported failure.
 * The compiler's output, if any, is available through the {@link #detailedMessage()} method.
 */
public final class BookCompilerFailedCondition extends SourceCondition {
    public BookCompilerFailedCondition(final Path marker, final String message, final @Nullable String output) {
        super(marker, message);
        this.output = output;
    }

    @Override
    public String detailedMessage() {
        return (output != null && !output.isBlank())
            ? (message() + '\n' + output.stripTrailing())
            : message();
    }

    private final @Nullable String output;
}
