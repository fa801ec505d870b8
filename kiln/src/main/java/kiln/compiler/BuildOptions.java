// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.compiler;

import kiln.config.BuildTag;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * How to run a build pass.
 *
 * @param tag                The output tag, selecting the destination root and manifest.
 * @param force              Whether to rebuild everything regardless of the manifest.
 * @param live               Whether pages get the live reload script.
 * @param liveReloadEndpoint The live reload WebSocket path, without the leading slash; required in live mode.
 */
public record BuildOptions(BuildTag tag, boolean force, boolean live, @Nullable String liveReloadEndpoint) {
    public BuildOptions {
        assert !live || liveReloadEndpoint != null : "Live builds need a live reload endpoint";
    }

    public static BuildOptions of(final BuildTag tag, final boolean force) {
        return new BuildOptions(tag, force, false, null);
    }
}
