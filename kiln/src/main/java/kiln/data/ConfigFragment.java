// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.nio.file.Path;
import kiln.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A loaded TOML data fragment: a directory's {@code data.toml}, a document's {@code name.toml}, a layout's
 * {@code layout.toml}, or a document's front matter.
 * <p>
 * Exactly one of {@code table} and {@code failure} is non-null. A failed fragment is kept around rather than
 * reported immediately, so that every document depending on it can report the failure itself.
 *
 * @param file     The fragment's path relative to the source root.
 * @param table    The parsed data, or {@code null} if parsing failed.
 * @param failure  The parse error, or {@code null} if parsing succeeded.
 * @param modified The fragment's modification time in epoch milliseconds.
 */
public record ConfigFragment(Path file, DataValue.@Nullable Table table, @Nullable String failure, long modified) {
    /**
     * Returns the parsed table, signaling a fatal {@link MalformedFragmentCondition} on behalf of the given document
     * if the fragment failed to parse.
     */
    public DataValue.Table tableFor(final Path document) {
        final var result = table;
        if (result == null) {
            throw ConditionContext.error(
                new MalformedFragmentCondition(document, file, String.valueOf(failure))
            );
        }
        return result;
    }
}
