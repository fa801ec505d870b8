// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.render;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

/**
 * Markdown to HTML conversion that leaves template tags alone.
 * <p>
 * Documents are converted before they are rendered as templates, so {@code {{tags}}} would otherwise be mangled by
 * Markdown: {@code {{first_name}}} contains emphasis, {@code {{{template}}}} may be taken apart. Every tag is
 * therefore swapped for a placeholder made of private-use characters before conversion and put back afterwards.
 * <p>
 * Thread-safe.
 */
public final class MarkdownConverter {
    private MarkdownConverter() {
    }

    /**
     * Converts a Markdown document that may contain template tags into an HTML template.
     */
    public static String toHtmlTemplate(final String markdown) {
        final var tags = new ArrayList<String>();
        final var matcher = templateTag.matcher(markdown);
        final var shielded = new StringBuilder(markdown.length());
        while (matcher.find()) {
            final var replacement = placeholderStart + tags.size() + placeholderEnd;
            matcher.appendReplacement(shielded, Matcher.quoteReplacement(replacement));
            tags.add(matcher.group());
        }
        matcher.appendTail(shielded);
        final var html = toHtml(shielded.toString());
        return tags.isEmpty() ? html : unshield(html, tags);
    }

    /**
     * Converts plain Markdown into HTML.
     */
    public static String toHtml(final String markdown) {
        return renderer.render(parser.parse(markdown));
    }

    private static String unshield(final String html, final List<String> tags) {
        final var matcher = placeholder.matcher(html);
        final var result = new StringBuilder(html.length());
        while (matcher.find()) {
            final var index = Integer.parseInt((matcher.group(1) != null) ? matcher.group(1) : matcher.group(2));
            matcher.appendReplacement(result, Matcher.quoteReplacement(tags.get(index)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static final String placeholderStart = "\uE000";
    private static final String placeholderEnd = "\uE001";
    private static final Pattern templateTag = Pattern.compile("\\{\\{\\{.*?}}}|\\{\\{.*?}}");
    // Inside link destinations the placeholder characters come out percent-encoded.
    private static final Pattern placeholder =
        Pattern.compile("\uE000(\\d+)\uE001|%EE%80%80(\\d+)%EE%80%81", Pattern.CASE_INSENSITIVE);
    private static final Parser parser = Parser.builder().build();
    private static final HtmlRenderer renderer = HtmlRenderer.builder().build();
}
