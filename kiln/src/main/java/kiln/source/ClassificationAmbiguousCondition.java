// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

import java.nio.file.Path;

/**
 * A warning that a file matched more than one classification rule. The file is classified by the earlier rule.
 */
public final class ClassificationAmbiguousCondition extends SourceCondition {
    ClassificationAmbiguousCondition(final Path source, final String explanation) {
        super(source, "Ambiguous classification: " + explanation);
    }
}
