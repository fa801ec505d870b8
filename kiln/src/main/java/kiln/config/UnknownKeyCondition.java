// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.config;

import kiln.util.condition.Condition;

/**
 * A warning about a key in {@code site.toml} that no part of the build reads. Usually a typo.
 */
public final class UnknownKeyCondition extends Condition {
    UnknownKeyCondition(final String key) {
        super("Unknown key in " + SiteSettings.settingsFileName + ": " + key);
        this.key = key;
    }

    /**
     * The dotted path of the offending key.
     */
    public String key() {
        return key;
    }

    private final String key;
}
