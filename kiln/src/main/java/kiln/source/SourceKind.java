// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.source;

/**
 * What a file in the source tree is for.
 */
public enum SourceKind {
    /** A Markdown or HTML page rendered through the template engine and its layouts. */
    DOCUMENT,
    /** A partial, a layout, or a layout's configuration. Never copied to the destination. */
    TEMPLATE,
    /** A directory or document data fragment. Never copied to the destination. */
    DATA,
    /** The marker of a book subtree, handed to the external book compiler. */
    BOOK,
    /** Anything else, copied to the destination verbatim. */
    ASSET,
    /** Excluded from the build altogether. */
    IGNORED,
}
