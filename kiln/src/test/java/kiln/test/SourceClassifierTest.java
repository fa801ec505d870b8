// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.nio.file.Path;
import java.util.Set;
import kiln.source.SourceClassifier;
import kiln.source.SourceKind;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class SourceClassifierTest {
    @Test
    void documentsDataAndAssets() {
        final var siblings = Set.of("post.md", "post.toml", "data.toml", "photo.jpg", "orphan.toml", "page.html");
        Assertions.assertThat(kindOf("blog/post.md", siblings)).isEqualTo(SourceKind.DOCUMENT);
        Assertions.assertThat(kindOf("blog/page.html", siblings)).isEqualTo(SourceKind.DOCUMENT);
        Assertions.assertThat(kindOf("blog/post.toml", siblings)).isEqualTo(SourceKind.DATA);
        Assertions.assertThat(kindOf("blog/data.toml", siblings)).isEqualTo(SourceKind.DATA);
        Assertions.assertThat(kindOf("blog/photo.jpg", siblings)).isEqualTo(SourceKind.ASSET);
        Assertions.assertThat(kindOf("blog/orphan.toml", siblings)).isEqualTo(SourceKind.ASSET);
    }

    @Test
    void layoutsAndTheirConfiguration() {
        final var withLayout = Set.of("layout.mustache", "layout.toml");
        Assertions.assertThat(kindOf("docs/layout.mustache", withLayout)).isEqualTo(SourceKind.TEMPLATE);
        Assertions.assertThat(kindOf("docs/layout.toml", withLayout)).isEqualTo(SourceKind.TEMPLATE);
        Assertions.assertThat(kindOf("docs/layout.toml", Set.of("layout.toml"))).isEqualTo(SourceKind.ASSET);
        Assertions.assertThat(kindOf("docs/other.mustache", withLayout)).isEqualTo(SourceKind.ASSET);
    }

    @Test
    void onlyPartialsCountInsideTemplates() {
        final var siblings = Set.of("header.mustache", "notes.txt");
        Assertions.assertThat(SourceClassifier.classify(Path.of("templates/header.mustache"), siblings, true).kind())
            .isEqualTo(SourceKind.TEMPLATE);
        Assertions.assertThat(SourceClassifier.classify(Path.of("templates/notes.txt"), siblings, true).kind())
            .isEqualTo(SourceKind.IGNORED);
    }

    @Test
    void layoutConfigurationNextToLayoutDocumentIsAmbiguous() {
        final var siblings = Set.of("layout.mustache", "layout.toml", "layout.md");
        final var classification = SourceClassifier.classify(Path.of("layout.toml"), siblings, false);
        Assertions.assertThat(classification.kind()).isEqualTo(SourceKind.TEMPLATE);
        Assertions.assertThat(classification.ambiguity()).contains("layout configuration");
    }

    @Test
    void unambiguousFilesReportNoAmbiguity() {
        final var classification = SourceClassifier.classify(Path.of("index.md"), Set.of("index.md"), false);
        Assertions.assertThat(classification.ambiguity()).isNull();
    }

    @Test
    void bookDirectoriesAreRecognizedByTheirMarker() {
        Assertions.assertThat(SourceClassifier.isBookDirectory(Set.of("book.toml", "src"))).isTrue();
        Assertions.assertThat(SourceClassifier.isBookDirectory(Set.of("data.toml", "src"))).isFalse();
    }

    private static SourceKind kindOf(final String path, final Set<String> siblings) {
        return SourceClassifier.classify(Path.of(path), siblings, false).kind();
    }
}
