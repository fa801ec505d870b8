// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.livereload;

/**
 * Where a live reload client is in the build cycle, as far as the events sent to it tell.
 */
public enum ClientState {
    IDLE,
    BUILDING,
    IDLE_WITH_ERROR,
    RELOADED;

    /**
     * Returns the state after the given event is delivered. A reloaded client closes its connection, so it stays
     * reloaded whatever comes next.
     */
    public ClientState next(final ReloadEvent event) {
        if (this == RELOADED) {
            return RELOADED;
        }
        if (event instanceof ReloadEvent.Start) {
            return BUILDING;
        }
        if (event instanceof final ReloadEvent.Notify notify) {
            return notify.error() ? IDLE_WITH_ERROR : IDLE;
        }
        return RELOADED;
    }
}
