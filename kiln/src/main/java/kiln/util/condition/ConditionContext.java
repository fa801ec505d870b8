// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util.condition;

import java.util.ArrayList;
import java.util.List;
import kiln.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Per-thread registry of condition handlers and restart points.
 * <p>
 * Every thread owns exactly one context. It is never handed out directly; the static methods below always act on
 * the context of the calling thread. Worker threads can borrow the thread-safe part of another thread's context
 * with {@link #saveInheritableState()} and {@link #inheritState(InheritedState)}.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition as a warning.
     * <p>
     * Handlers are run newest first. A handler that returns normally declines the condition and the next one is
     * tried; once every handler has declined, this method returns. A handler may instead unwind to a restart, in
     * which case this method exits by throwing {@link Unwind}.
     */
    public static void signal(final @NotNull Condition condition) {
        try {
            localContext().signal(new SignaledCondition(condition, false));
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
    }

    /**
     * Signals the given condition as fatal.
     * <p>
     * Handlers are run exactly as for {@link #signal(Condition)}, but declining is not an option: if every handler
     * returns normally, {@link UnhandledErrorError} is thrown. The return type only exists so that call sites can
     * write {@code throw ConditionContext.error(...)} and keep the compiler's flow analysis happy.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        try {
            localContext().signal(new SignaledCondition(condition, true));
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        }
        throw new UnhandledErrorError(condition);
    }

    /**
     * Reports an exception that cannot be propagated, typically one thrown while releasing a resource, as a
     * {@link SuppressedExceptionCondition} warning.
     * <p>
     * Handlers must not unwind in response: this is routinely called while the stack is already being unwound.
     */
    public static void signalSuppressedException(final @NotNull Exception exception) {
        try {
            SneakyThrow.<Unwind>pretendThrows();
            signal(new SuppressedExceptionCondition(exception));
        } catch (final Unwind u) {
            throw new AssertionError("A handler unwound in response to a suppressed exception", u);
        }
    }

    /**
     * Runs the given callback with a named restart point established around it.
     *
     * @param restartName The user-readable name of the restart, shown in interactive restart prompts and used by
     *                    {@link #findRestart(String)}.
     * @param callback    The code to run; it receives the freshly established restart.
     * @return The value returned by {@code callback}, or {@code null} if something unwound to this restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns a snapshot of the restart points visible from the calling thread, newest first.
     * <p>
     * Restarts inherited from a parent thread are included after the thread's own ones.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var result = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    /**
     * Finds the newest visible restart with the given name, or {@code null} if there is none.
     */
    public static @Nullable Restart findRestart(final @NotNull String restartName) {
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            if (restart.name().equals(restartName)) {
                return restart;
            }
        }
        return null;
    }

    /**
     * Captures the calling thread's restarts and handlers so that a worker thread can use them.
     * <p>
     * The whole handler chain is captured; handlers that are not {@link HandlerProcedure.ThreadSafe} are skipped
     * when a condition is signaled from another thread.
     */
    public static @NotNull InheritedState saveInheritableState() {
        final var context = localContext();
        return new InheritedState(context.firstHandler, context.firstRestart);
    }

    /**
     * Installs previously captured state into the calling thread, whose context must be empty.
     *
     * @return A token to pass to {@link #restoreState(PreviousState)} once the inherited work is done.
     */
    public static @NotNull PreviousState inheritState(final @NotNull InheritedState inheritedState) {
        final var context = localContext();
        assert context.firstHandler == null : "Inheriting into a thread that has handlers of its own";
        assert context.firstRestart == null : "Inheriting into a thread that has restarts of its own";
        context.firstHandler = inheritedState.firstHandler;
        context.firstRestart = inheritedState.firstRestart;
        return PreviousState.instance;
    }

    /**
     * Empties the calling thread's context again after {@link #inheritState(InheritedState)}.
     */
    public static void restoreState(@SuppressWarnings("unused") final @NotNull PreviousState previousState) {
        final var context = localContext();
        context.firstHandler = null;
        context.firstRestart = null;
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull SignaledCondition condition) throws Unwind {
        // While a handler runs, only the handlers established before it are eligible, so that a handler signaling
        // a condition of its own does not recurse into itself.
        var handler = (currentHandler == null) ? firstHandler : currentHandler.next;
        for (; handler != null; handler = handler.next) {
            if (!handler.usableIn(this)) {
                continue;
            }
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } finally {
                currentHandler = saved;
            }
        }
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * Opaque snapshot of a context's handlers and restarts.
     */
    public static final class InheritedState {
        private InheritedState(final @Nullable Handler firstHandler, final @Nullable Restart firstRestart) {
            this.firstHandler = firstHandler;
            this.firstRestart = firstRestart;
        }

        private final @Nullable Handler firstHandler;
        private final @Nullable Restart firstRestart;
    }

    /**
     * Opaque token returned by {@link #inheritState(InheritedState)}.
     */
    public static final class PreviousState {
        private PreviousState() {
        }

        private static final PreviousState instance = new PreviousState();
    }
}
