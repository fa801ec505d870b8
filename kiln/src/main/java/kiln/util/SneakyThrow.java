// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util;

/**
 * Throwing checked exceptions without declaring them.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable, whatever its type, without the compiler requiring it to be declared.
     * <p>
     * Reserved for {@link InterruptedException}, which nearly everything here can throw, and for
     * {@link kiln.util.condition.Unwind}, which is control flow rather than failure. Everything else is reported
     * through conditions.
     * <p>
     * Declared to return {@link UnreachableCodeReachedError} so call sites can write {@code throw doThrow(e)}.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    /**
     * Pretends to throw {@code E}, so that a sneakily thrown {@code E} can be caught by the caller.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // E erases to Throwable, so the cast vanishes from the bytecode; the caller picks E = RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
