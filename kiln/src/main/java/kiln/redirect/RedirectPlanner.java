// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.redirect;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Turns the {@code [redirect]} table into redirect pages, rejecting tables that cannot work.
 * <p>
 * A redirect from a path ending in a slash, or from a path whose last segment has no extension, is written as that
 * directory's {@code index.html}; any other path is written as is. A chain of redirects, each target redirected
 * again, must end within {@value #maxRedirects} hops without visiting a path twice. Trailing slashes are ignored
 * when matching a target against the table.
 */
public final class RedirectPlanner {
    private RedirectPlanner() {
    }

    /**
     * Validates the table and returns its redirects in key order.
     */
    public static List<Redirect> plan(final Map<String, String> table) {
        try (final var trace = new Trace("Checking the redirect table")) {
            trace.use();
            final var result = new ArrayList<Redirect>(table.size());
            for (final var entry : table.entrySet()) {
                final var from = entry.getKey();
                final var to = entry.getValue();
                checkTarget(from, to);
                checkChain(table, from);
                result.add(new Redirect(from, to, destinationOf(from)));
            }
            return result;
        }
    }

    private static Path destinationOf(final String from) {
        var path = from;
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        final var segments = path.split("/", -1);
        for (int i = 0; i < segments.length; i += 1) {
            final var segment = segments[i];
            final var last = i == segments.length - 1;
            if ((segment.isEmpty() && !last) || segment.equals(".") || segment.equals("..")
                || segment.indexOf('\\') >= 0) {
                throw ConditionContext.error(new RedirectCondition("Invalid redirect path: " + from));
            }
        }
        final var lastSegment = segments[segments.length - 1];
        if (lastSegment.isEmpty()) {
            return Path.of(path + indexFileName);
        }
        if (lastSegment.indexOf('.') < 0) {
            return Path.of(path, indexFileName);
        }
        return Path.of(path);
    }

    private static void checkTarget(final String from, final String to) {
        if (to.isEmpty()) {
            throw ConditionContext.error(new RedirectCondition("Redirect " + from + " has an empty target"));
        }
        for (int i = 0; i < to.length(); i += 1) {
            final var c = to.charAt(i);
            if (c <= ' ' || c == 0x7F || forbiddenTargetCharacters.indexOf(c) >= 0) {
                throw ConditionContext.error(new RedirectCondition(
                    "Redirect " + from + " has a target with a character that must be percent-encoded: " + to
                ));
            }
        }
    }

    private static void checkChain(final Map<String, String> table, final String from) {
        final var visited = new ArrayList<String>();
        visited.add(trimTrailingSlashes(from));
        var current = table.get(from);
        while (current != null) {
            final var next = lookUp(table, current);
            if (next == null) {
                return;
            }
            final var key = trimTrailingSlashes(current);
            if (visited.contains(key)) {
                throw ConditionContext.error(new RedirectCondition(
                    "Cyclic redirect: " + String.join(" -> ", visited) + " -> " + key
                ));
            }
            if (visited.size() >= maxRedirects) {
                throw ConditionContext.error(new RedirectCondition(
                    "Too many redirects starting at " + from + ", the limit is " + maxRedirects
                ));
            }
            visited.add(key);
            current = next;
        }
    }

    private static @Nullable String lookUp(final Map<String, String> table, final String current) {
        final var exact = table.get(current);
        if (exact != null) {
            return exact;
        }
        final var trimmed = trimTrailingSlashes(current);
        final var withoutSlash = table.get(trimmed);
        return (withoutSlash != null) ? withoutSlash : table.get(trimmed + '/');
    }

    private static String trimTrailingSlashes(final String path) {
        var end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end -= 1;
        }
        return path.substring(0, end);
    }

    static final int maxRedirects = 4;
    private static final String indexFileName = "index.html";
    private static final String forbiddenTargetCharacters = "\"'<>\\`";
}
