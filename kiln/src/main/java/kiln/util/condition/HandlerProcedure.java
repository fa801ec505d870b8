// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The code run by a {@link Handler} when a condition is signaled.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to a signaled condition.
     * <p>
     * Returning normally declines the condition. Handling it means leaving non-locally, usually through
     * {@link Restart#unwindTo()}.
     */
    void handle(@NotNull SignaledCondition condition) throws Unwind;

    /**
     * Marker for procedures that may be invoked concurrently from several threads.
     * <p>
     * Only procedures of this type are consulted by worker threads that inherited their parent's context.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
