// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition.exception;

import java.io.IOException;

/**
 * A condition reporting an {@link IOException} that makes the whole build impossible, such as an unwritable
 * destination directory.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
