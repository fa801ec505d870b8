// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.manifest;

import java.nio.file.Path;
import kiln.util.condition.Condition;

/**
 * A condition type indicating that the manifest file cannot be parsed.
 * <p>
 * Fatal for the whole build, since nothing can be said about which outputs are current. In force mode, where the
 * manifest is not consulted anyway, it is only a warning and the build starts from an empty manifest.
 */
public final class ManifestCorruptCondition extends Condition {
    ManifestCorruptCondition(final Path manifestPath, final String problem) {
        super("Corrupt build manifest " + manifestPath + "; delete it or rebuild with --force");
        this.problem = problem;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + problem;
    }

    private final String problem;
}
