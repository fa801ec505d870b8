// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import kiln.compiler.BuildReport;
import kiln.config.BuildTag;
import kiln.config.SettingsLoader;
import kiln.livereload.ReloadEvent;
import kiln.livereload.ReloadScript;
import kiln.watch.LiveSession;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class LiveSessionTest {
    @Test
    void sourceChangesAreRebuiltAndAnnounced(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.writeProjectFile("site.toml", "[live]\nport = 0\ndebounce_ms = 100\n")
                .write("layout.mustache", "<body>{{{template}}}</body>")
                .write("index.md", "Home");
            final var reports = new LinkedBlockingQueue<BuildReport>();
            final var settings = SettingsLoader.load(dir);
            try (final var session = new LiveSession(site.compiler(), settings, BuildTag.DEBUG, false, reports::add)) {
                session.start();
                final var first = next(reports);
                Assertions.assertThat(first.status()).isEqualTo(BuildReport.Status.SUCCESS);
                Assertions.assertThat(site.output("index.html")).contains(ReloadScript.fileName);
                Assertions.assertThat(site.output(ReloadScript.fileName)).contains(session.coordinator().endpoint());

                final var port = session.coordinator().server().port();
                try (final var browser = ReloadClient.connect(port, session.coordinator().endpoint())) {
                    ReloadClient.awaitClients(session.coordinator(), 1);

                    site.write("about.md", "About");
                    final var second = next(reports);
                    Assertions.assertThat(second.status()).isEqualTo(BuildReport.Status.SUCCESS);
                    Assertions.assertThat(second.rendered()).isEqualTo(1);
                    Assertions.assertThat(site.output("about/index.html")).contains("<p>About</p>");
                    Assertions.assertThat(browser.receive()).isEqualTo(new ReloadEvent.Start());
                    Assertions.assertThat(browser.receive()).isEqualTo(new ReloadEvent.Notify("Building...", false));
                    Assertions.assertThat(browser.receive()).isEqualTo(new ReloadEvent.Reload(null));
                }
            }
        }
    }

    @Test
    void failedPassIsReportedToTheBrowser(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.writeProjectFile("site.toml", "[live]\nport = 0\ndebounce_ms = 100\n").write("index.md", "Home");
            final var reports = new LinkedBlockingQueue<BuildReport>();
            final var settings = SettingsLoader.load(dir);
            try (final var session = new LiveSession(site.compiler(), settings, BuildTag.DEBUG, false, reports::add)) {
                session.start();
                next(reports);
                final var port = session.coordinator().server().port();
                try (final var browser = ReloadClient.connect(port, session.coordinator().endpoint())) {
                    ReloadClient.awaitClients(session.coordinator(), 1);

                    site.write("broken.md", "+++\ntitle = \"never closed\"\n");
                    final var report = next(reports);
                    Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.PARTIAL_FAILURE);
                    Assertions.assertThat(browser.receive()).isEqualTo(new ReloadEvent.Start());
                    Assertions.assertThat(browser.receive()).isEqualTo(new ReloadEvent.Notify("Building...", false));
                    final var failure = browser.receive();
                    Assertions.assertThat(failure).isInstanceOf(ReloadEvent.Notify.class);
                    final var notification = (ReloadEvent.Notify) failure;
                    Assertions.assertThat(notification.error()).isTrue();
                    Assertions.assertThat(notification.message()).startsWith(report.summary()).contains("broken.md");
                }
            }
        }
    }

    @Test
    void explicitRequestsRunAPass(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.writeProjectFile("site.toml", "[live]\nport = 0\n").write("index.md", "Home");
            final var reports = new LinkedBlockingQueue<BuildReport>();
            final var settings = SettingsLoader.load(dir);
            try (final var session = new LiveSession(site.compiler(), settings, BuildTag.DEBUG, true, reports::add)) {
                session.start();
                Assertions.assertThat(next(reports).rendered()).isEqualTo(1);
                session.requestBuild();
                final var second = next(reports);
                Assertions.assertThat(second.rendered()).isZero();
                Assertions.assertThat(second.skipped()).isEqualTo(1);
            }
        }
    }

    private static BuildReport next(final BlockingQueue<BuildReport> reports) throws InterruptedException {
        final var report = reports.poll(10, TimeUnit.SECONDS);
        Assertions.assertThat(report).as("build report within the timeout").isNotNull();
        return report;
    }
}
