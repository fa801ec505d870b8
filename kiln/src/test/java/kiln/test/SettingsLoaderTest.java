// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import kiln.config.BuildTag;
import kiln.config.SettingsCondition;
import kiln.config.SettingsLoader;
import kiln.config.SiteSettings;
import kiln.config.UnknownKeyCondition;
import kiln.data.DataValue;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class SettingsLoaderTest {
    @Test
    void missingFileYieldsDefaults(@TempDir final Path dir) {
        final var settings = SettingsLoader.load(dir);
        Assertions.assertThat(settings).isEqualTo(SiteSettings.defaults(dir));
        Assertions.assertThat(settings.sourceDirectory()).isEqualTo(dir.resolve("site"));
        Assertions.assertThat(settings.destinationDirectory(BuildTag.DEBUG)).isEqualTo(dir.resolve("build/debug"));
        Assertions.assertThat(settings.cleanUrls()).isTrue();
    }

    @Test
    void everySectionIsRead(@TempDir final Path dir) throws IOException {
        Files.writeString(dir.resolve(SiteSettings.settingsFileName), """
            [build]
            source = "content"
            target = "out"
            clean_urls = false
            ignore = ["*.bak"]
            threads = 2

            [page]
            author = "Alice"

            [book]
            command = ["mdbook", "build"]
            theme = "theme"

            [live]
            port = 9000
            debounce_ms = 200
            """);
        final var settings = SettingsLoader.load(dir);
        Assertions.assertThat(settings.sourceDirectory()).isEqualTo(dir.resolve("content"));
        Assertions.assertThat(settings.destinationDirectory(BuildTag.RELEASE)).isEqualTo(dir.resolve("out/release"));
        Assertions.assertThat(settings.cleanUrls()).isFalse();
        Assertions.assertThat(settings.ignorePatterns()).containsExactly("*.bak");
        Assertions.assertThat(settings.threads()).isEqualTo(2);
        Assertions.assertThat(settings.page().get("author")).isEqualTo(new DataValue.Text("Alice"));
        Assertions.assertThat(settings.bookCommand()).containsExactly("mdbook", "build");
        Assertions.assertThat(settings.bookTheme()).isEqualTo(Path.of("theme"));
        Assertions.assertThat(settings.bookThemeExplicit()).isTrue();
        Assertions.assertThat(settings.liveHost()).isEqualTo("127.0.0.1");
        Assertions.assertThat(settings.livePort()).isEqualTo(9000);
        Assertions.assertThat(settings.debounce()).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    void unknownKeysAreWarnings(@TempDir final Path dir) throws IOException {
        Files.writeString(dir.resolve(SiteSettings.settingsFileName), """
            [build]
            sorce = "typo"

            [extra]
            value = 1
            """);
        final var capture = ConditionCapture.run(() -> SettingsLoader.load(dir));
        Assertions.assertThat(capture.fatal()).isNull();
        Assertions.assertThat(capture.warnings())
            .hasSize(2)
            .allSatisfy(condition -> Assertions.assertThat(condition).isInstanceOf(UnknownKeyCondition.class));
        Assertions.assertThat(capture.warnings())
            .extracting(condition -> condition.message())
            .anySatisfy(message -> Assertions.assertThat(message).contains("build.sorce"))
            .anySatisfy(message -> Assertions.assertThat(message).contains("extra"));
    }

    @Test
    void redirectKeysAreTheUsersOwn(@TempDir final Path dir) throws IOException {
        Files.writeString(dir.resolve(SiteSettings.settingsFileName), """
            [redirect]
            "/old/" = "/new/"
            "/blog/feed.xml" = "https://example.com/feed.xml"
            """);
        final var capture = ConditionCapture.run(() -> SettingsLoader.load(dir));
        Assertions.assertThat(capture.fatal()).isNull();
        Assertions.assertThat(capture.warnings()).isEmpty();
        Assertions.assertThat(capture.result().redirects()).containsExactly(
            Map.entry("/blog/feed.xml", "https://example.com/feed.xml"),
            Map.entry("/old/", "/new/")
        );
    }

    @Test
    void wrongTypesAreFatal(@TempDir final Path dir) throws IOException {
        for (final var content : List.of(
            "[build]\nclean_urls = \"yes\"\n",
            "[build]\nthreads = -1\n",
            "[live]\nport = 70000\n",
            "[book]\ncommand = []\n",
            "[redirect]\n\"/old/\" = 1\n",
            "redirect = \"/new/\"\n",
            "build = 3\n",
            "[build\n"
        )) {
            Files.writeString(dir.resolve(SiteSettings.settingsFileName), content);
            final var capture = ConditionCapture.run(() -> SettingsLoader.load(dir));
            Assertions.assertThat(capture.fatal()).as(content).isInstanceOf(SettingsCondition.class);
        }
    }
}
