// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.nio.file.Path;
import kiln.source.SourceCondition;
import kiln.util.PathUtils;

/**
 * A condition type indicating that a data fragment defines a key the renderer reserves for itself.
 */
public final class ReservedKeyCondition extends SourceCondition {
    ReservedKeyCondition(final Path document, final Path fragment, final String key) {
        super(document, "Reserved key '" + key + "' defined in " + PathUtils.toPortableString(fragment));
        this.key = key;
    }

    public String key() {
        return key;
    }

    private final String key;
}
