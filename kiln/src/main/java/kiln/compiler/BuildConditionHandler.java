// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.compiler;

import kiln.source.SourceCondition;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.HandlerProcedure;
import kiln.util.condition.SignaledCondition;

/**
 * The handler in effect during a build pass.
 * <p>
 * Warnings are recorded and declined, so outer handlers still see them. A fatal {@link SourceCondition} fails
 * just the document or book being built, unwinding to its {@value Compiler#skipDocumentRestart} restart; any other
 * fatal condition unwinds to {@value Compiler#abortBuildRestart}.
 */
final class BuildConditionHandler implements HandlerProcedure.ThreadSafe {
    BuildConditionHandler(final BuildReport.Collector collector) {
        this.collector = collector;
    }

    @Override
    public void handle(final SignaledCondition signaled) {
        final var condition = signaled.condition();
        if (!signaled.isFatal()) {
            collector.warning(condition);
            return;
        }
        if (condition instanceof SourceCondition) {
            final var skip = ConditionContext.findRestart(Compiler.skipDocumentRestart);
            if (skip != null) {
                collector.failure(condition);
                skip.unwindTo();
            }
        }
        final var abort = ConditionContext.findRestart(Compiler.abortBuildRestart);
        if (abort != null) {
            collector.abort(condition);
            abort.unwindTo();
        }
    }

    private final BuildReport.Collector collector;
}
