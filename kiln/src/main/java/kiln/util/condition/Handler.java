// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An established condition handler. Meant to be used with try-with-resources, so that the handler is active exactly
 * for the dynamic extent of the block.
 */
public final class Handler implements AutoCloseable {
    /**
     * Establishes the given procedure as the newest handler of the calling thread.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        ownerContext = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing. Referencing the resource variable keeps "unused resource" warnings quiet.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Disestablishes the handler. Handlers must be closed in reverse order of establishment, by the owning thread.
     */
    @Override
    public void close() {
        assert ownerContext == ConditionContext.localContext() : "Handler closed by a foreign thread";
        assert ownerContext.firstHandler == this : "Handlers closed out of order";
        ownerContext.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    boolean usableIn(final @NotNull ConditionContext context) {
        return ownerContext == context || procedure instanceof HandlerProcedure.ThreadSafe;
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext ownerContext;
}
