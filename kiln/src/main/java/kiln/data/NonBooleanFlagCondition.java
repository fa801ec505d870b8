// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.nio.file.Path;
import kiln.source.SourceCondition;

/**
 * A warning that a flag such as {@code standalone} or {@code draft} holds something other than a boolean.
 * The flag is treated as unset.
 */
public final class NonBooleanFlagCondition extends SourceCondition {
    public NonBooleanFlagCondition(final Path document, final String key, final DataValue value) {
        super(document, "Flag '" + key + "' should be a boolean, found a " + value.typeName() + "; ignoring it");
    }
}
