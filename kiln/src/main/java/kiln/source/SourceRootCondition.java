// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.Path;
import kiln.util.condition.Condition;

/**
 * A condition type indicating that the source root does not exist or is not a directory. Fatal for the whole build.
 */
public final class SourceRootCondition extends Condition {
    SourceRootCondition(final Path sourceRoot) {
        super("The source root is not a readable directory: " + sourceRoot);
    }
}
