// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.book;

/**
 * An external compiler for book subtrees.
 */
@FunctionalInterface
public interface BookCompiler {
    /**
     * Compiles the book described by the request into its output directory.
     * <p>
     * Implementations report failure by signaling a fatal {@link BookCompilerFailedCondition}. They may be invoked
     * from several threads at once, each time with a distinct output directory.
     */
    void compile(BookRequest request);
}
