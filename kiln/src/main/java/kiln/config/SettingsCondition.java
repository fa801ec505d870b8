// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.config;

import kiln.util.condition.Condition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition type indicating that {@code site.toml} could not be parsed or holds a value of the wrong type.
 * Always fatal for the whole build.
 */
public final class SettingsCondition extends Condition {
    SettingsCondition(final String message) {
        this(message, null);
    }

    SettingsCondition(final String message, final @Nullable String details) {
        super(message);
        this.details = details;
    }

    @Override
    public String detailedMessage() {
        return (details != null) ? (message() + '\n' + details) : message();
    }

    private final @Nullable String details;
}
