// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import kiln.book.BookCompilerFailedCondition;
import kiln.book.BookRequest;
import kiln.book.ProcessBookCompiler;
import kiln.source.BookProject;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
final class ProcessBookCompilerTest {
    @Test
    void placeholdersAndEnvironmentReachTheCommand(@TempDir final Path dir) throws Exception {
        final var project = project(dir);
        final var output = Files.createDirectories(dir.resolve("out"));
        final var theme = Files.createDirectories(dir.resolve("theme"));
        final var script = "printf '%s|%s|%s|%s' \"$1\" \"$(pwd -P)\" \"$MDBOOK_OUTPUT__HTML__THEME\" "
            + "\"$MDBOOK_OUTPUT__HTML__LIVE_RELOAD_ENDPOINT\" > \"$2/index.html\"";
        new ProcessBookCompiler().compile(new BookRequest(
            project,
            output,
            List.of("sh", "-c", script, "sh", "{source}", "{output}"),
            theme,
            "/__livereload/abc"
        ));
        final var root = project.root().toAbsolutePath().toString();
        Assertions.assertThat(Files.readString(output.resolve("index.html"))).isEqualTo(
            root + '|' + project.root().toRealPath() + '|' + theme.toAbsolutePath() + "|/__livereload/abc"
        );
    }

    @Test
    void nonZeroExitIsAFailureCarryingTheOutput(@TempDir final Path dir) throws Exception {
        final var project = project(dir);
        final var request = new BookRequest(
            project,
            Files.createDirectories(dir.resolve("out")),
            List.of("sh", "-c", "echo 'SUMMARY.md not found' >&2; exit 3"),
            null,
            null
        );
        final var capture = ConditionCapture.run(() -> new ProcessBookCompiler().compile(request));
        Assertions.assertThat(capture.fatal()).isInstanceOf(BookCompilerFailedCondition.class);
        Assertions.assertThat(capture.fatal().detailedMessage())
            .contains("status 3")
            .contains("SUMMARY.md not found");
    }

    @Test
    void missingExecutableIsAFailure(@TempDir final Path dir) throws Exception {
        final var request = new BookRequest(
            project(dir),
            Files.createDirectories(dir.resolve("out")),
            List.of("kiln-test-no-such-book-compiler"),
            null,
            null
        );
        final var capture = ConditionCapture.run(() -> new ProcessBookCompiler().compile(request));
        Assertions.assertThat(capture.fatal()).isInstanceOf(BookCompilerFailedCondition.class);
    }

    @Test
    void interruptingTheBuildKillsTheCompiler(@TempDir final Path dir) throws Exception {
        final var pidFile = dir.resolve("pid");
        final var writePidAndSleep = "echo $$ > \"$1.tmp\" && mv \"$1.tmp\" \"$1\" && exec sleep 60";
        final var request = new BookRequest(
            project(dir),
            Files.createDirectories(dir.resolve("out")),
            List.of("sh", "-c", writePidAndSleep, "sh", pidFile.toString()),
            null,
            null
        );
        final var thrown = new AtomicReference<Throwable>();
        final var worker = new Thread(() -> {
            try {
                new ProcessBookCompiler().compile(request);
            } catch (final Throwable t) {
                thrown.set(t);
            }
        });
        worker.start();
        final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while (!Files.exists(pidFile) && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        Assertions.assertThat(pidFile).exists();

        worker.interrupt();
        worker.join(TimeUnit.SECONDS.toMillis(20));
        Assertions.assertThat(worker.isAlive()).isFalse();
        Assertions.assertThat(thrown.get()).isInstanceOf(InterruptedException.class);

        final var child = ProcessHandle.of(Long.parseLong(Files.readString(pidFile).strip()));
        if (child.isPresent()) {
            child.get().onExit().get(20, TimeUnit.SECONDS);
        }
    }

    private static BookProject project(final Path dir) throws Exception {
        final var root = Files.createDirectories(dir.resolve("site/manual"));
        Files.writeString(root.resolve("book.toml"), "[book]\n");
        return new BookProject(root, Path.of("manual"), root.resolve("book.toml"));
    }
}
