// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import kiln.util.condition.Condition;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.Handler;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs code under a handler that records every warning and unwinds on the first fatal condition.
 */
final class ConditionCapture<T> {
    private ConditionCapture() {
    }

    static <T> ConditionCapture<T> run(final Supplier<T> body) {
        final var capture = new ConditionCapture<T>();
        ConditionContext.withRestart("test-abort", restart -> {
            try (final var handler = new Handler(signaled -> {
                if (signaled.isFatal()) {
                    capture.fatal = signaled.condition();
                    restart.unwindTo();
                }
                capture.warnings.add(signaled.condition());
            })) {
                handler.use();
                capture.result = body.get();
                return capture;
            }
        });
        return capture;
    }

    static ConditionCapture<Void> run(final Runnable body) {
        return run(() -> {
            body.run();
            return null;
        });
    }

    @Nullable T result() {
        return result;
    }

    @Nullable Condition fatal() {
        return fatal;
    }

    List<Condition> warnings() {
        return warnings;
    }

    private @Nullable T result = null;
    private @Nullable Condition fatal = null;
    private final List<Condition> warnings = new ArrayList<>();
}
