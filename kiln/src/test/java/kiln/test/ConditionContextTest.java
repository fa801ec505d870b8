// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import kiln.util.CollectionExecutorService;
import kiln.util.condition.Condition;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.Handler;
import kiln.util.condition.HandlerProcedure;
import kiln.util.condition.UnhandledErrorError;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void declinedWarningReturnsToTheSignaler() {
        final var seen = new ArrayList<String>();
        try (final var handler = new Handler(condition -> seen.add(condition.condition().message()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("first"));
            ConditionContext.signal(new TestCondition("second"));
        }
        Assertions.assertThat(seen).containsExactly("first", "second");
    }

    @Test
    void handlerUnwindsThroughSignalToTheRestart() {
        final var after = new ArrayList<String>();
        try (final var handler = new Handler(condition -> unwindTo("give-up"))) {
            handler.use();
            final var result = ConditionContext.withRestart("give-up", restart -> {
                ConditionContext.signal(new TestCondition("warning"));
                after.add("reached");
                return "finished";
            });
            Assertions.assertThat(result).isNull();
        }
        Assertions.assertThat(after).isEmpty();
    }

    @Test
    void innerRestartLeavesOuterOneIntact() {
        try (final var handler = new Handler(condition -> unwindTo("inner"))) {
            handler.use();
            final var outer = ConditionContext.withRestart("outer", outerRestart -> {
                final var inner = ConditionContext.withRestart("inner", innerRestart -> {
                    throw ConditionContext.error(new TestCondition("fatal"));
                });
                Assertions.assertThat(inner).isNull();
                return "outer finished";
            });
            Assertions.assertThat(outer).isEqualTo("outer finished");
        }
        Assertions.assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void fatalConditionNobodyHandlesIsAnError() {
        try (final var handler = new Handler(condition -> {
        })) {
            handler.use();
            Assertions.assertThatThrownBy(() -> ConditionContext.error(new TestCondition("lost")))
                .isInstanceOf(UnhandledErrorError.class)
                .hasMessageContaining("lost");
        }
    }

    @Test
    void workerConditionsReachTheSubmittersHandlerAndRestart() {
        final var executor = Executors.newFixedThreadPool(4);
        try {
            final var warnings = new CopyOnWriteArrayList<String>();
            final HandlerProcedure.ThreadSafe procedure = condition -> {
                if (condition.isFatal()) {
                    unwindTo("stop");
                }
                warnings.add(condition.condition().message());
            };
            try (final var handler = new Handler(procedure)) {
                handler.use();
                final var result = ConditionContext.withRestart("stop", restart -> {
                    new CollectionExecutorService(executor).forEach(List.of(1, 2, 3, 4), item -> {
                        ConditionContext.signal(new TestCondition("item " + item));
                        if (item == 3) {
                            throw ConditionContext.error(new TestCondition("broken " + item));
                        }
                    });
                    return "finished";
                });
                Assertions.assertThat(result).isNull();
            }
            Assertions.assertThat(warnings).contains("item 3");
        } finally {
            executor.shutdownNow();
        }
    }

    private static void unwindTo(final String name) {
        Objects.requireNonNull(ConditionContext.findRestart(name), name).unwindTo();
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
