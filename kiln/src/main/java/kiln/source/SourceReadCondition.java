// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A condition type indicating that a single source file could not be read.
 */
public final class SourceReadCondition extends SourceCondition {
    public SourceReadCondition(final Path source, final IOException exception) {
        super(source, "Cannot read the file: " + exception.getMessage());
        this.exception = exception;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nCause: " + exception;
    }

    private final IOException exception;
}
