// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.book;

import java.nio.file.Path;
import java.util.List;
import kiln.source.BookProject;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One invocation of a {@link BookCompiler}.
 *
 * @param project            The book to compile.
 * @param outputDirectory    An empty scratch directory the compiler writes the book into.
 * @param command            The command line template, with {@code {source}} and {@code {output}} placeholders.
 * @param themeDirectory     The theme directory to use, or {@code null} for the compiler's own theme.
 * @param liveReloadEndpoint The live reload WebSocket path the book pages should connect to, or {@code null}
 *                           outside live mode.
 */
public record BookRequest(
    BookProject project,
    Path outputDirectory,
    List<String> command,
    @Nullable Path themeDirectory,
    @Nullable String liveReloadEndpoint
) {
    public BookRequest {
        command = List.copyOf(command);
    }
}
