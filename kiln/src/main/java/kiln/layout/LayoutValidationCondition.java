// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.layout;

import java.nio.file.Path;
import kiln.source.SourceCondition;

/**
 * A condition type indicating that a document names a layout that cannot be used as one: a missing file,
 * a document, or anything else that is not a template.
 */
public final class LayoutValidationCondition extends SourceCondition {
    LayoutValidationCondition(final Path document, final String problem) {
        super(document, "Invalid layout: " + problem);
    }
}
