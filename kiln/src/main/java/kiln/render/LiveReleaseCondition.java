// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.render;

import kiln.util.condition.Condition;

/**
 * A warning that a release build is being served live, so its pages carry the reload script. Such output should
 * not be deployed.
 */
public final class LiveReleaseCondition extends Condition {
    public LiveReleaseCondition() {
        super("Live reload is enabled for a release build; its pages include the reload script");
    }
}
