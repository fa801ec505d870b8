// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.render;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Block helpers available to every template, used as {@code {{#name}}...{{/name}}}.
 */
final class TemplateHelpers {
    private TemplateHelpers() {
    }

    static Map<String, Object> all() {
        return helpers;
    }

    static String slugify(final String text) {
        final var decomposed = Normalizer.normalize(text.strip(), Normalizer.Form.NFKD);
        final var ascii = nonSpacingMarks.matcher(decomposed).replaceAll("");
        final var slug = ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("^-+|-+$", "");
    }

    private static Function<@Nullable String, @Nullable String> helper(final Function<String, String> body) {
        return text -> (text == null) ? null : body.apply(text);
    }

    private static final Pattern nonSpacingMarks = Pattern.compile("\\p{Mn}+");

    private static final Map<String, Object> helpers = Map.of(
        "markdown", helper(MarkdownConverter::toHtml),
        "slug", helper(TemplateHelpers::slugify),
        "upper", helper(text -> text.toUpperCase(Locale.ROOT)),
        "lower", helper(text -> text.toLowerCase(Locale.ROOT))
    );
}
