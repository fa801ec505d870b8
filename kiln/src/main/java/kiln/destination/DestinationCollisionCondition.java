// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.destination;

import java.nio.file.Path;
import kiln.source.SourceCondition;
import kiln.util.PathUtils;

/**
 * A condition type indicating that two documents would be rendered to the same output file. Signaled for the
 * document that loses; the other one is rendered normally.
 */
public final class DestinationCollisionCondition extends SourceCondition {
    DestinationCollisionCondition(final Path document, final Path winner) {
        super(
            document,
            "Produces the same output as " + PathUtils.toPortableString(winner) + ", which takes precedence"
        );
        this.winner = winner;
    }

    public Path winner() {
        return winner;
    }

    private final Path winner;
}
