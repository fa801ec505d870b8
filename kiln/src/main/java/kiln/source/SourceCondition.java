// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.Path;
import kiln.util.PathUtils;
import kiln.util.condition.Condition;

/**
 * Base type of conditions tied to one source file.
 * <p>
 * Signaled as a warning, such a condition is recorded and the build goes on. Signaled as an error, it fails the
 * affected document or book, and only that: the build skips it and carries on with the rest of the tree.
 */
public abstract class SourceCondition extends Condition {
    protected SourceCondition(final Path source, final String message) {
        super(PathUtils.toPortableString(source) + ": " + message);
        this.source = source;
    }

    /**
     * The source file, relative to the source root, whose output is affected.
     */
    public final Path source() {
        return source;
    }

    private final Path source;
}
