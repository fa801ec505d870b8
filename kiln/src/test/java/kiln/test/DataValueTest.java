// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.util.List;
import java.util.Map;
import kiln.data.DataValue;
import kiln.data.Titles;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class DataValueTest {
    @Test
    void overlayReplacesKeysAndKeepsTheRest() {
        final var base = new DataValue.Table(Map.of(
            "author", new DataValue.Text("Alice"),
            "tags", new DataValue.Array(List.of(new DataValue.Text("a")))
        ));
        final var overlay = new DataValue.Table(Map.of("author", new DataValue.Text("Bob")));
        final var merged = base.merge(overlay);
        Assertions.assertThat(merged.get("author")).isEqualTo(new DataValue.Text("Bob"));
        Assertions.assertThat(merged.get("tags")).isEqualTo(base.get("tags"));
        Assertions.assertThat(base.get("author")).isEqualTo(new DataValue.Text("Alice"));
    }

    @Test
    void nestedTablesAreReplacedWhole() {
        final var base = DataValue.Table.empty().with(
            "nav",
            DataValue.Table.empty().with("home", new DataValue.Text("/")).with("blog", new DataValue.Text("/blog/"))
        );
        final var overlay = DataValue.Table.empty().with(
            "nav",
            DataValue.Table.empty().with("home", new DataValue.Text("/index.html"))
        );
        final var nav = (DataValue.Table) base.merge(overlay).get("nav");
        Assertions.assertThat(nav).isNotNull();
        Assertions.assertThat(nav.containsKey("blog")).isFalse();
        Assertions.assertThat(nav.get("home")).isEqualTo(new DataValue.Text("/index.html"));
    }

    @Test
    void templateValuesAreMapsListsAndScalars() {
        final var table = DataValue.Table.empty()
            .with("count", new DataValue.Integral(3))
            .with("draft", new DataValue.Bool(false))
            .with("tags", new DataValue.Array(List.of(new DataValue.Text("x"), new DataValue.Text("y"))));
        Assertions.assertThat(table.toTemplateValue())
            .containsEntry("count", 3L)
            .containsEntry("draft", false)
            .containsEntry("tags", List.of("x", "y"));
    }

    @Test
    void titlesAreHumanized() {
        Assertions.assertThat(Titles.humanize("my-first_post")).isEqualTo("My First Post");
        Assertions.assertThat(Titles.humanize("blog")).isEqualTo("Blog");
        Assertions.assertThat(Titles.humanize("iPhone-review")).isEqualTo("IPhone Review");
        Assertions.assertThat(Titles.humanize("--")).isEmpty();
    }
}
