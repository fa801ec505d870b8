// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.manifest;

import java.nio.file.Path;
import kiln.util.condition.Condition;

/**
 * A warning that the manifest was written by an incompatible version or for another tag. It is discarded and
 * everything is rebuilt.
 */
public final class ManifestVersionCondition extends Condition {
    ManifestVersionCondition(final Path manifestPath, final String found) {
        super("Discarding incompatible build manifest " + manifestPath + " (" + found + ")");
    }
}
