// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.config;

/**
 * The output tag of a build. Each tag has its own destination directory and manifest.
 */
public enum BuildTag {
    DEBUG("debug"),
    RELEASE("release");

    BuildTag(final String directoryName) {
        this.directoryName = directoryName;
    }

    /**
     * The name of the tag, which is also the name of its directory under the target base.
     */
    public String directoryName() {
        return directoryName;
    }

    public boolean isRelease() {
        return this == RELEASE;
    }

    private final String directoryName;
}
