// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.util.Locale;

/**
 * Titles inferred from file names.
 */
public final class Titles {
    private Titles() {
    }

    /**
     * Turns a file stem into a title: {@code my-first_post} becomes {@code My First Post}.
     * <p>
     * Dashes, underscores and dots separate words; the first letter of every word is capitalized and the rest of
     * the word is kept as is.
     */
    public static String humanize(final String stem) {
        final var builder = new StringBuilder(stem.length());
        for (final var word : stem.split("[-_.\\s]+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            final var first = word.codePointAt(0);
            builder.append(new String(Character.toChars(first)).toUpperCase(Locale.ROOT));
            builder.append(word, Character.charCount(first), word.length());
        }
        return builder.toString();
    }
}
