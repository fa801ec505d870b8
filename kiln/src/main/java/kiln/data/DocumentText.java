// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.io.IOException;
import java.nio.file.Files;
import kiln.source.SourceEntry;
import kiln.source.SourceReadCondition;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A document's text, split into its front matter and its body.
 * <p>
 * Front matter is TOML at the very start of the document, between two {@code +++} lines in Markdown documents, or
 * between {@code <!--} and {@code -->} lines in HTML documents.
 *
 * @param frontMatter The front matter without its delimiters, or {@code null} if the document has none.
 * @param body        Everything after the front matter.
 */
public record DocumentText(@Nullable String frontMatter, String body) {
    /**
     * Reads and splits the given document.
     * <p>
     * Signals a fatal {@link SourceReadCondition} if the file cannot be read, and a fatal
     * {@link MalformedFragmentCondition} if the front matter is never closed.
     */
    public static DocumentText read(final SourceEntry document) {
        try (final var trace = new Trace(() -> "Reading document " + document)) {
            trace.use();
            final String text;
            try {
                text = Files.readString(document.absolutePath());
            } catch (final IOException e) {
                throw ConditionContext.error(new SourceReadCondition(document.relativePath(), e));
            }
            return split(document, text);
        }
    }

    static DocumentText split(final SourceEntry document, final String text) {
        final var opening = document.isMarkdown() ? markdownDelimiter : htmlOpening;
        final var closing = document.isMarkdown() ? markdownDelimiter : htmlClosing;
        final var content = text.startsWith(byteOrderMark) ? text.substring(1) : text;
        final var firstLineEnd = lineEnd(content, 0);
        if (!content.substring(0, firstLineEnd).strip().equals(opening)) {
            return new DocumentText(null, content);
        }
        var position = nextLine(content, firstLineEnd);
        final var frontMatterStart = position;
        while (position < content.length()) {
            final var end = lineEnd(content, position);
            if (content.substring(position, end).strip().equals(closing)) {
                final var frontMatter = content.substring(frontMatterStart, position);
                return new DocumentText(frontMatter, content.substring(nextLine(content, end)));
            }
            position = nextLine(content, end);
        }
        throw ConditionContext.error(new MalformedFragmentCondition(
            document.relativePath(),
            document.relativePath(),
            "Front matter opened with '" + opening + "' is never closed with '" + closing + "'"
        ));
    }

    private static int lineEnd(final String text, final int from) {
        final var index = text.indexOf('\n', from);
        return (index == -1) ? text.length() : index;
    }

    private static int nextLine(final String text, final int lineEnd) {
        return Math.min(text.length(), lineEnd + 1);
    }

    private static final String byteOrderMark = "\uFEFF";
    private static final String markdownDelimiter = "+++";
    private static final String htmlOpening = "<!--";
    private static final String htmlClosing = "-->";
}
