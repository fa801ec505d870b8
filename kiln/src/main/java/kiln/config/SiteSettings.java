// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import kiln.data.DataValue;

/**
 * The project settings from {@code site.toml}, with defaults filled in.
 *
 * @param projectDirectory The directory holding {@code site.toml}.
 * @param sourceDirectory  The absolute source root.
 * @param targetDirectory  The absolute target base; each tag builds into a subdirectory of it.
 * @param cleanUrls        Whether documents map to {@code name/index.html} rather than {@code name.html}.
 * @param followLinks      Whether the source scan follows symbolic links.
 * @param ignorePatterns   Project-wide ignore patterns, consulted before any {@code .kilnignore}.
 * @param threads          The number of worker threads; zero means one per available processor.
 * @param page             Global page data, the first layer of every document's data.
 * @param bookCommand      The external book compiler command line, with {@code {source}} and {@code {output}}
 *                         placeholders.
 * @param bookTheme        The book theme directory, relative to the source root.
 * @param bookThemeExplicit Whether the theme directory was configured explicitly rather than defaulted.
 * @param liveHost         The interface the live server binds to.
 * @param livePort         The port the live server binds to.
 * @param debounce         The quiet period the watcher waits for before starting a build.
 * @param redirects        The {@code [redirect]} table: old URL paths mapped to the locations they now live at,
 *                         in key order.
 */
public record SiteSettings(
    Path projectDirectory,
    Path sourceDirectory,
    Path targetDirectory,
    boolean cleanUrls,
    boolean followLinks,
    List<String> ignorePatterns,
    int threads,
    DataValue.Table page,
    List<String> bookCommand,
    Path bookTheme,
    boolean bookThemeExplicit,
    String liveHost,
    int livePort,
    Duration debounce,
    Map<String, String> redirects
) {
    public SiteSettings {
        ignorePatterns = List.copyOf(ignorePatterns);
        bookCommand = List.copyOf(bookCommand);
        redirects = Collections.unmodifiableMap(new TreeMap<>(redirects));
    }

    /**
     * Returns the destination root of the given tag.
     */
    public Path destinationDirectory(final BuildTag tag) {
        return targetDirectory.resolve(tag.directoryName());
    }

    /**
     * Returns the settings used when the project has no {@code site.toml}.
     */
    public static SiteSettings defaults(final Path projectDirectory) {
        return new SiteSettings(
            projectDirectory,
            projectDirectory.resolve(defaultSourceDirectoryName),
            projectDirectory.resolve(defaultTargetDirectoryName),
            true,
            false,
            List.of(),
            0,
            DataValue.Table.empty(),
            defaultBookCommand,
            Path.of(defaultBookTheme),
            false,
            defaultLiveHost,
            defaultLivePort,
            Duration.ofMillis(defaultDebounceMillis),
            Map.of()
        );
    }

    public static final String settingsFileName = "site.toml";
    static final String defaultSourceDirectoryName = "site";
    static final String defaultTargetDirectoryName = "build";
    static final List<String> defaultBookCommand = List.of("mdbook", "build", "{source}", "--dest-dir", "{output}");
    static final String defaultBookTheme = "templates/book-theme";
    static final String defaultLiveHost = "127.0.0.1";
    static final int defaultLivePort = 8080;
    static final long defaultDebounceMillis = 50;
}
