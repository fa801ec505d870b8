// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import kiln.data.DataValue;
import kiln.data.TomlValues;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.UnhandledErrorError;
import kiln.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;

/**
 * Reads {@code site.toml}.
 * <p>
 * A missing file yields the defaults. Unknown sections and keys are reported as {@link UnknownKeyCondition}
 * warnings; syntax errors and values of the wrong type are fatal {@link SettingsCondition}s. The keys of
 * {@code [page]} and {@code [redirect]} are the user's own, so neither is checked for unknown keys.
 */
public final class SettingsLoader {
    private SettingsLoader() {
    }

    public static SiteSettings load(final Path projectDirectory) {
        final var settingsPath = projectDirectory.resolve(SiteSettings.settingsFileName);
        try (final var trace = new Trace(() -> "Loading project settings from " + settingsPath)) {
            trace.use();
            final var defaults = SiteSettings.defaults(projectDirectory);
            if (!Files.isRegularFile(settingsPath)) {
                return defaults;
            }
            final TomlTable root;
            try {
                final var result = Toml.parse(settingsPath);
                if (result.hasErrors()) {
                    throw ConditionContext.error(new SettingsCondition(
                        "Malformed " + SiteSettings.settingsFileName,
                        TomlValues.describeErrors(result)
                    ));
                }
                root = result;
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            return fromToml(projectDirectory, root, defaults);
        }
    }

    private static SiteSettings fromToml(
        final Path projectDirectory,
        final TomlTable root,
        final SiteSettings defaults
    ) {
        for (final var key : root.keySet()) {
            if (!knownKeys.containsKey(key)) {
                ConditionContext.signal(new UnknownKeyCondition(key));
            }
        }
        final var build = section(root, "build");
        final var page = section(root, "page");
        final var book = section(root, "book");
        final var live = section(root, "live");
        final var redirect = section(root, "redirect");

        final var source = stringValue(build, "build.source");
        final var target = stringValue(build, "build.target");
        final var cleanUrls = booleanValue(build, "build.clean_urls");
        final var followLinks = booleanValue(build, "build.follow_links");
        final var ignore = stringList(build, "build.ignore");
        final var threads = longValue(build, "build.threads");
        final var bookCommand = stringList(book, "book.command");
        final var bookTheme = stringValue(book, "book.theme");
        final var liveHost = stringValue(live, "live.host");
        final var livePort = longValue(live, "live.port");
        final var debounce = longValue(live, "live.debounce_ms");

        if (threads != null && (threads < 0 || threads > maxThreads)) {
            throw ConditionContext.error(new SettingsCondition("build.threads out of range: " + threads));
        }
        if (livePort != null && (livePort < 0 || livePort > 65535)) {
            throw ConditionContext.error(new SettingsCondition("live.port out of range: " + livePort));
        }
        if (debounce != null && debounce < 0) {
            throw ConditionContext.error(new SettingsCondition("live.debounce_ms must not be negative"));
        }
        if (bookCommand != null && bookCommand.isEmpty()) {
            throw ConditionContext.error(new SettingsCondition("book.command must not be empty"));
        }

        return new SiteSettings(
            projectDirectory,
            (source != null) ? projectDirectory.resolve(source).normalize() : defaults.sourceDirectory(),
            (target != null) ? projectDirectory.resolve(target).normalize() : defaults.targetDirectory(),
            (cleanUrls != null) ? cleanUrls : defaults.cleanUrls(),
            (followLinks != null) ? followLinks : defaults.followLinks(),
            (ignore != null) ? ignore : defaults.ignorePatterns(),
            (threads != null) ? threads.intValue() : defaults.threads(),
            (page != null) ? TomlValues.toTable(page) : DataValue.Table.empty(),
            (bookCommand != null) ? bookCommand : defaults.bookCommand(),
            (bookTheme != null) ? Path.of(bookTheme) : defaults.bookTheme(),
            bookTheme != null,
            (liveHost != null) ? liveHost : defaults.liveHost(),
            (livePort != null) ? livePort.intValue() : defaults.livePort(),
            (debounce != null) ? Duration.ofMillis(debounce) : defaults.debounce(),
            (redirect != null) ? redirects(redirect) : defaults.redirects()
        );
    }

    private static Map<String, String> redirects(final TomlTable section) {
        final var result = new TreeMap<String, String>();
        for (final var entry : section.entrySet()) {
            if (!(entry.getValue() instanceof final String target)) {
                throw typeMismatch("redirect." + entry.getKey(), "a string");
            }
            result.put(entry.getKey(), target);
        }
        return result;
    }

    private static @Nullable TomlTable section(final TomlTable root, final String name) {
        final var value = root.get(List.of(name));
        if (value == null) {
            return null;
        }
        if (!(value instanceof final TomlTable table)) {
            throw ConditionContext.error(new SettingsCondition("[" + name + "] must be a table"));
        }
        final var known = knownKeys.get(name);
        if (known != null && !freeFormSections.contains(name)) {
            for (final var key : table.keySet()) {
                if (!known.contains(key)) {
                    ConditionContext.signal(new UnknownKeyCondition(name + '.' + key));
                }
            }
        }
        return table;
    }

    private static @Nullable Object rawValue(final @Nullable TomlTable section, final String dottedKey) {
        if (section == null) {
            return null;
        }
        return section.get(List.of(dottedKey.substring(dottedKey.indexOf('.') + 1)));
    }

    private static @Nullable String stringValue(final @Nullable TomlTable section, final String dottedKey) {
        final var value = rawValue(section, dottedKey);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw typeMismatch(dottedKey, "a string");
    }

    private static @Nullable Boolean booleanValue(final @Nullable TomlTable section, final String dottedKey) {
        final var value = rawValue(section, dottedKey);
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw typeMismatch(dottedKey, "a boolean");
    }

    private static @Nullable Long longValue(final @Nullable TomlTable section, final String dottedKey) {
        final var value = rawValue(section, dottedKey);
        if (value == null || value instanceof Long) {
            return (Long) value;
        }
        throw typeMismatch(dottedKey, "an integer");
    }

    private static @Nullable List<String> stringList(final @Nullable TomlTable section, final String dottedKey) {
        final var value = rawValue(section, dottedKey);
        if (value == null) {
            return null;
        }
        if (!(value instanceof final TomlArray array)) {
            throw typeMismatch(dottedKey, "an array of strings");
        }
        final var result = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i += 1) {
            if (!(array.get(i) instanceof final String string)) {
                throw typeMismatch(dottedKey, "an array of strings");
            }
            result.add(string);
        }
        return result;
    }

    private static UnhandledErrorError typeMismatch(final String dottedKey, final String expected) {
        return ConditionContext.error(new SettingsCondition(dottedKey + " must be " + expected));
    }

    private static final long maxThreads = 1024;
    private static final Set<String> freeFormSections = Set.of("page", "redirect");
    private static final Map<String, Set<String>> knownKeys = Map.of(
        "build", Set.of("source", "target", "clean_urls", "follow_links", "ignore", "threads"),
        "page", Set.of(),
        "book", Set.of("command", "theme"),
        "live", Set.of("host", "port", "debounce_ms"),
        "redirect", Set.of()
    );
}
