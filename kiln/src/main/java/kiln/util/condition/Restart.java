// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition;

import kiln.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named point the stack can be unwound to.
 * <p>
 * Restarts are only created by {@link ConditionContext#withRestart(String, RestartCallback)}; handlers discover
 * them through {@link ConditionContext#restarts()} or {@link ConditionContext#findRestart(String)}.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        ownerContext = context;
        context.firstRestart = this;
    }

    /**
     * Retrieves the name this restart was established with.
     */
    public @NotNull String name() {
        return name;
    }

    /**
     * Unwinds the stack to this restart. Never returns.
     * <p>
     * When the restart belongs to another thread, the {@link Unwind} travels out of the worker and is rethrown
     * in the owner by {@link kiln.util.CollectionExecutorService}.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    @Override
    public @NotNull String toString() {
        return "Restart[" + name + "]";
    }

    void unlink() {
        assert ownerContext == ConditionContext.localContext() : "Restart unlinked by a foreign thread";
        assert ownerContext.firstRestart == this : "Restarts unlinked out of order";
        ownerContext.firstRestart = next;
    }

    final @Nullable Restart next;
    private final @NotNull String name;
    private final @NotNull ConditionContext ownerContext;
}
