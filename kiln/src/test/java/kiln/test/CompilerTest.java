// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.nio.file.Files;
import java.nio.file.Path;
import kiln.compiler.BuildOptions;
import kiln.compiler.BuildReport;
import kiln.config.BuildTag;
import kiln.livereload.ReloadScript;
import kiln.manifest.ManifestStore;
import org.assertj.core.api.Assertions;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class CompilerTest {
    @Test
    void rendersMarkdownThroughTheNearestLayout(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<title>{{title}}</title><main>{{{template}}}</main>")
                .write("index.md", "Hello *world*")
                .write("style.css", "body {}");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(report.copied()).isEqualTo(1);
            Assertions.assertThat(report.exitCode()).isZero();
            Assertions.assertThat(site.output("index.html"))
                .isEqualTo("<title>Site</title><main><p>Hello <em>world</em></p>\n</main>");
            Assertions.assertThat(site.output("style.css")).isEqualTo("body {}");
            Assertions.assertThat(site.hasOutput("layout.mustache")).isFalse();
        }
    }

    @Test
    void secondPassSkipsEverything(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<main>{{{template}}}</main>")
                .write("index.md", "Home")
                .write("about.md", "About")
                .write("blog/post.md", "Post")
                .write("img/logo.svg", "<svg/>");
            final var first = site.build();
            Assertions.assertThat(first.rendered()).isEqualTo(3);
            Assertions.assertThat(first.copied()).isEqualTo(1);

            final var second = site.build();
            Assertions.assertThat(second.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(second.rendered()).isZero();
            Assertions.assertThat(second.skipped()).isEqualTo(3);
            Assertions.assertThat(second.copied()).isZero();
        }
    }

    @Test
    void touchingOneDocumentRebuildsOnlyThatDocument(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home")
                .write("about.md", "About")
                .write("contact.md", "Contact");
            site.build();
            site.write("about.md", "About us");
            site.touch("about.md");
            final var report = site.build();
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(report.skipped()).isEqualTo(2);
            Assertions.assertThat(site.output("about/index.html")).isEqualTo("<p>About us</p>\n");
        }
    }

    @Test
    void forceRebuildsUpToDateDocuments(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home").write("about.md", "About");
            site.build();
            final var report = site.build(BuildOptions.of(BuildTag.DEBUG, true));
            Assertions.assertThat(report.rendered()).isEqualTo(2);
            Assertions.assertThat(report.skipped()).isZero();
        }
    }

    @Test
    void deletedOutputIsRebuilt(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home").write("about.md", "About");
            site.build();
            Files.delete(site.destination(BuildTag.DEBUG).resolve("about/index.html"));
            final var report = site.build();
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(site.hasOutput("about/index.html")).isTrue();
        }
    }

    @Test
    void ancestorDataChangeInvalidatesDescendants(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("about.md", "{{author}}")
                .write("blog/data.toml", "author = \"Alice\"")
                .write("blog/post.md", "{{author}}");
            site.build();
            Assertions.assertThat(site.output("blog/post/index.html")).isEqualTo("<p>Alice</p>\n");

            site.write("blog/data.toml", "author = \"Bob\"");
            site.touch("blog/data.toml");
            final var report = site.build();
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(report.skipped()).isEqualTo(1);
            Assertions.assertThat(site.output("blog/post/index.html")).isEqualTo("<p>Bob</p>\n");
        }
    }

    @Test
    void layoutChangeInvalidatesEveryDocumentUsingIt(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<main>{{{template}}}</main>")
                .write("index.md", "Home")
                .write("about.md", "About");
            site.build();
            site.write("layout.mustache", "<body>{{{template}}}</body>");
            site.touch("layout.mustache");
            final var report = site.build();
            Assertions.assertThat(report.rendered()).isEqualTo(2);
            Assertions.assertThat(site.output("index.html")).isEqualTo("<body><p>Home</p>\n</body>");
        }
    }

    @Test
    void dataIsLayeredFromTheRootDown(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.writeProjectFile("site.toml", "[page]\nauthor = \"Site\"\nlicense = \"CC0\"\n")
                .write("data.toml", "author = \"Root\"\nsection = \"none\"")
                .write("blog/data.toml", "section = \"blog\"")
                .write("blog/post.toml", "author = \"Sidecar\"")
                .write("blog/post.md", "{{author}} {{section}} {{license}}")
                .write("blog/other.md", "+++\nauthor = \"Front\"\n+++\n{{author}} {{section}} {{license}}")
                .write("about.md", "{{author}} {{section}} {{license}}");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(site.output("blog/post/index.html")).isEqualTo("<p>Sidecar blog CC0</p>\n");
            Assertions.assertThat(site.output("blog/other/index.html")).isEqualTo("<p>Front blog CC0</p>\n");
            Assertions.assertThat(site.output("about/index.html")).isEqualTo("<p>Root none CC0</p>\n");
            Assertions.assertThat(site.hasOutput("blog/post.toml")).isFalse();
        }
    }

    @Test
    void titlesAreInferredFromFileAndDirectoryNames(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "{{title}}")
                .write("blog/index.md", "Posts")
                .write("blog/my-first_post.md", "First")
                .write("named.md", "+++\ntitle = \"Explicit\"\n+++\nNamed");
            site.build();
            Assertions.assertThat(site.output("blog/index.html")).isEqualTo("Blog");
            Assertions.assertThat(site.output("blog/my-first_post/index.html")).isEqualTo("My First Post");
            Assertions.assertThat(site.output("named/index.html")).isEqualTo("Explicit");
        }
    }

    @Test
    void cleanUrlConflictDemotesTheFlatDocument(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("about.md", "Flat").write("about/index.md", "Index");
            site.build();
            Assertions.assertThat(site.output("about.html")).isEqualTo("<p>Flat</p>\n");
            Assertions.assertThat(site.output("about/index.html")).isEqualTo("<p>Index</p>\n");
        }
    }

    @Test
    void cleanUrlsCanBeDisabledPerProjectAndPerDocument(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.writeProjectFile("site.toml", "[build]\nclean_urls = false\n")
                .write("flat.md", "Flat")
                .write("pretty.md", "+++\nclean_urls = true\n+++\nPretty");
            site.build();
            Assertions.assertThat(site.hasOutput("flat.html")).isTrue();
            Assertions.assertThat(site.hasOutput("pretty/index.html")).isTrue();
        }
    }

    @Test
    void standaloneDocumentsBypassLayouts(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<main>{{{template}}}</main>")
                .write("feed.html", "<!--\nstandalone = true\n-->\n<feed>{{title}}</feed>");
            site.build();
            Assertions.assertThat(site.output("feed/index.html")).isEqualTo("<feed>Feed</feed>");
        }
    }

    @Test
    void extendingLayoutsNest(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<html>{{{template}}}</html>")
                .write("blog/layout.mustache", "<article>{{{template}}}</article>")
                .write("blog/layout.toml", "extends = true")
                .write("docs/layout.mustache", "<section>{{{template}}}</section>")
                .write("blog/post.html", "Post")
                .write("docs/page.html", "Page");
            site.build();
            Assertions.assertThat(site.output("blog/post/index.html"))
                .isEqualTo("<html><article>Post</article></html>");
            Assertions.assertThat(site.output("docs/page/index.html")).isEqualTo("<section>Page</section>");
            Assertions.assertThat(site.hasOutput("blog/layout.toml")).isFalse();
        }
    }

    @Test
    void layoutConfigurationIsNotDocumentData(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<main>{{{template}}}</main>")
                .write("layout.toml", "color = \"red\"")
                .write("layout.md", "[{{color}}]");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(report.warnings())
                .singleElement(InstanceOfAssertFactories.STRING)
                .contains("layout.toml");
            Assertions.assertThat(site.output("layout/index.html")).isEqualTo("<main><p>[]</p>\n</main>");
        }
    }

    @Test
    void explicitLayoutsAndPartialsAreUsed(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<main>{{{template}}}</main>")
                .write("templates/wide.mustache", "<wide>{{> footer}}{{{template}}}</wide>")
                .write("templates/footer.mustache", "[{{context.tag}}]")
                .write("page.html", "<!--\nlayout = \"templates/wide.mustache\"\n-->\nPage");
            site.build();
            Assertions.assertThat(site.output("page/index.html")).isEqualTo("<wide>[debug]Page</wide>");
            Assertions.assertThat(site.hasOutput("templates/footer.mustache")).isFalse();
        }
    }

    @Test
    void invalidExplicitLayoutFailsOnlyThatDocument(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("ok.html", "Fine")
                .write("missing.html", "<!--\nlayout = \"nowhere.mustache\"\n-->\nBroken")
                .write("document.html", "<!--\nlayout = \"ok.html\"\n-->\nBroken");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.PARTIAL_FAILURE);
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(report.failed()).isEqualTo(2);
            Assertions.assertThat(report.failures())
                .anySatisfy(message -> Assertions.assertThat(message).contains("nowhere.mustache"))
                .anySatisfy(message -> Assertions.assertThat(message).contains("ok.html"));
            Assertions.assertThat(site.hasOutput("missing/index.html")).isFalse();
        }
    }

    @Test
    void oneMalformedSidecarFailsOneDocument(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            for (int i = 0; i < 10; i += 1) {
                site.write("page" + i + ".md", "Page " + i);
            }
            site.write("page3.toml", "title = = \"broken\"");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.PARTIAL_FAILURE);
            Assertions.assertThat(report.rendered()).isEqualTo(9);
            Assertions.assertThat(report.failed()).isEqualTo(1);
            Assertions.assertThat(report.exitCode()).isEqualTo(1);
            Assertions.assertThat(report.failures())
                .singleElement(InstanceOfAssertFactories.STRING)
                .contains("page3.toml");
            Assertions.assertThat(site.hasOutput("page3/index.html")).isFalse();
        }
    }

    @Test
    void failedDocumentIsRetriedOnTheNextPass(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home").write("page.md", "Page").write("page.toml", "= broken");
            Assertions.assertThat(site.build().failed()).isEqualTo(1);
            site.write("page.toml", "ok = true");
            site.touch("page.toml");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(report.skipped()).isEqualTo(1);
        }
    }

    @Test
    void everyDocumentFailingFailsTheBuild(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("data.toml", "[broken").write("index.md", "Home").write("about.md", "About");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.FAILED);
            Assertions.assertThat(report.failed()).isEqualTo(2);
        }
    }

    @Test
    void malformedDirectoryDataFailsOnlyItsSubtree(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home")
                .write("a/data.toml", "author = ")
                .write("a/one.md", "One")
                .write("a/nested/two.md", "Two")
                .write("b/three.md", "Three");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.PARTIAL_FAILURE);
            Assertions.assertThat(report.rendered()).isEqualTo(2);
            Assertions.assertThat(report.failed()).isEqualTo(2);
            Assertions.assertThat(report.failures())
                .hasSize(2)
                .allSatisfy(failure -> Assertions.assertThat(failure).contains("a/data.toml"));
            Assertions.assertThat(site.outputFiles()).containsExactly(
                ManifestStore.fileName,
                "b/three/index.html",
                "index.html"
            );
        }
    }

    @Test
    void reservedKeysAreRejected(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home").write("bad.md", "+++\ncontext = \"mine\"\n+++\nBad");
            final var report = site.build();
            Assertions.assertThat(report.failed()).isEqualTo(1);
            Assertions.assertThat(report.failures())
                .singleElement(InstanceOfAssertFactories.STRING)
                .contains("context");
        }
    }

    @Test
    void htmlWinsOverMarkdownOfTheSameName(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("about.md", "Markdown").write("about.html", "Html");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.PARTIAL_FAILURE);
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(report.failed()).isEqualTo(1);
            Assertions.assertThat(site.output("about/index.html")).isEqualTo("Html");
        }
    }

    @Test
    void templateSyntaxErrorFailsTheDocument(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.html", "Fine").write("broken.html", "{{#section}}never closed");
            final var report = site.build();
            Assertions.assertThat(report.failed()).isEqualTo(1);
            Assertions.assertThat(report.rendered()).isEqualTo(1);
        }
    }

    @Test
    void draftsAreLeftOutOfReleaseBuilds(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home").write("draft.md", "+++\ndraft = true\n+++\nDraft");
            final var debug = site.build();
            Assertions.assertThat(debug.rendered()).isEqualTo(2);

            final var release = site.build(BuildOptions.of(BuildTag.RELEASE, false));
            Assertions.assertThat(release.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(release.rendered()).isEqualTo(1);
            Assertions.assertThat(release.excluded()).isEqualTo(1);
            Assertions.assertThat(Files.exists(site.destination(BuildTag.RELEASE).resolve("draft/index.html")))
                .isFalse();
            Assertions.assertThat(site.output(BuildTag.RELEASE, "index.html")).isEqualTo("<p>Home</p>\n");
        }
    }

    @Test
    void contextDescribesTheBuild(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("blog/post.html", "{{context.tag}} {{context.source}} {{context.destination}} {{context.live}}");
            site.build(BuildOptions.of(BuildTag.RELEASE, false));
            Assertions.assertThat(site.output(BuildTag.RELEASE, "blog/post/index.html"))
                .isEqualTo("release blog/post.html blog/post/index.html false");
        }
    }

    @Test
    void outputsOfDeletedSourcesArePruned(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home").write("about.md", "About").write("old.css", "old");
            site.build();
            site.delete("about.md");
            site.delete("old.css");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(site.outputFiles()).containsExactly(ManifestStore.fileName, "index.html");
        }
    }

    @Test
    void ignoredFilesAreNotBuilt(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.writeProjectFile("site.toml", "[build]\nignore = [\"*.bak\"]\n")
                .write("index.md", "Home")
                .write("index.md.bak", "Backup")
                .write(".hidden.md", "Hidden")
                .write("notes/.kilnignore", "private/\n")
                .write("notes/public.md", "Public")
                .write("notes/private/secret.md", "Secret");
            site.build();
            Assertions.assertThat(site.outputFiles())
                .containsExactly(ManifestStore.fileName, "index.html", "notes/public/index.html");
        }
    }

    @Test
    void liveBuildsInjectTheReloadScript(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<html><body>{{{template}}}</body></html>").write("index.md", "Home");
            final var live = site.build(new BuildOptions(BuildTag.DEBUG, false, true, "__livereload/abc"));
            Assertions.assertThat(live.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(site.output("index.html")).isEqualTo(
                "<html><body><p>Home</p>\n<script src=\"/__livereload.js\"></script></body></html>"
            );
            Assertions.assertThat(site.output(ReloadScript.fileName)).contains("__livereload/abc");
            Assertions.assertThat(site.hasOutput(ReloadScript.stylesheetFileName)).isTrue();

            final var normal = site.build();
            Assertions.assertThat(normal.rendered()).isEqualTo(1);
            Assertions.assertThat(site.output("index.html")).isEqualTo("<html><body><p>Home</p>\n</body></html>");
            Assertions.assertThat(site.hasOutput(ReloadScript.fileName)).isFalse();
            Assertions.assertThat(site.hasOutput(ReloadScript.stylesheetFileName)).isFalse();
        }
    }

    @Test
    void reloadScriptLandsBeforeBodyEndAfterCaseFoldingText(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("layout.mustache", "<html><BODY>{{{template}}}</Body></html>")
                .write("index.md", "\u0130stanbul \u0130zmir");
            site.build(new BuildOptions(BuildTag.DEBUG, false, true, "__livereload/abc"));
            Assertions.assertThat(site.output("index.html")).isEqualTo(
                "<html><BODY><p>\u0130stanbul \u0130zmir</p>\n<script src=\"/__livereload.js\"></script></Body></html>"
            );
        }
    }

    @Test
    void corruptManifestAbortsUnlessForced(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home");
            final var destination = site.destination(BuildTag.DEBUG);
            Files.createDirectories(destination);
            Files.writeString(destination.resolve(ManifestStore.fileName), "{not json");

            final var aborted = site.build();
            Assertions.assertThat(aborted.status()).isEqualTo(BuildReport.Status.ABORTED);
            Assertions.assertThat(aborted.exitCode()).isEqualTo(1);
            Assertions.assertThat(aborted.failures()).hasSize(1);
            Assertions.assertThat(site.hasOutput("index.html")).isFalse();

            final var forced = site.build(BuildOptions.of(BuildTag.DEBUG, true));
            Assertions.assertThat(forced.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(forced.rendered()).isEqualTo(1);
            Assertions.assertThat(forced.warnings()).hasSize(1);
            Assertions.assertThat(site.build().skipped()).isEqualTo(1);
        }
    }

    @Test
    void malformedSettingsAbortTheBuild(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.writeProjectFile("site.toml", "[build]\nthreads = \"many\"\n").write("index.md", "Home");
            final var report = site.build();
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.ABORTED);
            Assertions.assertThat(report.failures())
                .singleElement(InstanceOfAssertFactories.STRING)
                .contains("build.threads");
        }
    }

    @Test
    void nonBooleanDraftFlagIsAWarning(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "+++\ndraft = \"yes\"\n+++\nHome");
            final var report = site.build(BuildOptions.of(BuildTag.RELEASE, false));
            Assertions.assertThat(report.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(report.rendered()).isEqualTo(1);
            Assertions.assertThat(report.warnings())
                .singleElement(InstanceOfAssertFactories.STRING)
                .contains("draft");
        }
    }

    @Test
    void manifestWithNullEntryAbortsUnlessForced(@TempDir final Path dir) throws Exception {
        try (final var site = new SiteFixture(dir)) {
            site.write("index.md", "Home");
            final var destination = site.destination(BuildTag.DEBUG);
            Files.createDirectories(destination);
            Files.writeString(
                destination.resolve(ManifestStore.fileName),
                "{\"version\": 1, \"tag\": \"debug\", \"entries\": [null]}"
            );

            final var aborted = site.build();
            Assertions.assertThat(aborted.status()).isEqualTo(BuildReport.Status.ABORTED);
            Assertions.assertThat(aborted.failures())
                .singleElement(InstanceOfAssertFactories.STRING)
                .contains("entry 0 is null");

            final var forced = site.build(BuildOptions.of(BuildTag.DEBUG, true));
            Assertions.assertThat(forced.status()).isEqualTo(BuildReport.Status.SUCCESS);
            Assertions.assertThat(forced.rendered()).isEqualTo(1);
        }
    }
}
