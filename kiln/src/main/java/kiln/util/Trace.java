// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.util;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A breadcrumb describing what the current thread is doing, meant for try-with-resources.
 * <p>
 * Traces are for people reading a build failure, not for debugging the program: "Rendering blog/post.md",
 * "Loading data fragment blog/data.toml". When a condition is reported, the active traces are printed newest first.
 * <p>
 * A trace must only be closed by the thread that created it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a trace whose message is computed only if somebody asks for it.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = localContext.get();
        next = context.firstTrace;
        this.messageOrSupplier = messageOrSupplier;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns the calling thread's active trace messages, newest first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localContext.get().firstTrace; trace != null; trace = trace.next) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing. Referencing the resource variable keeps "unused resource" warnings quiet.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert ownerContext == localContext.get() : "Trace closed by a foreign thread";
        assert ownerContext.firstTrace == this : "Traces closed out of order";
        ownerContext.firstTrace = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    @SuppressWarnings("nullness:type.argument")
    private static final ThreadLocal<Context> localContext = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself or the MessageSupplier producing it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    /**
     * A lazily computed trace message.
     */
    @FunctionalInterface
    public interface MessageSupplier {
        String get();
    }

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }
}
