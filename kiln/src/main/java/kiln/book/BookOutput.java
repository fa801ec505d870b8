// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.book;

import kiln.source.BookProject;

/**
 * What happened to one book during a pass.
 *
 * @param project     The book.
 * @param status      Whether the book was compiled, skipped as up to date, or left out as a draft.
 * @param filesCopied The number of files copied into the destination; zero unless compiled.
 */
public record BookOutput(BookProject project, Status status, int filesCopied) {
    public enum Status {
        BUILT,
        UP_TO_DATE,
        EXCLUDED,
    }
}
