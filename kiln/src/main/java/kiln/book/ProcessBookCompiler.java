// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.book;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import kiln.source.BookProject;
import kiln.util.SneakyThrow;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;

/**
 * Runs the configured book command as a child process in the book's root directory.
 * <p>
 * The theme directory and the live reload endpoint are passed through the environment, using the variable names
 * mdBook reads its {@code output.html} configuration overrides from.
 */
public final class ProcessBookCompiler implements BookCompiler {
    @Override
    public void compile(final BookRequest request) {
        final var project = request.project();
        try (final var trace = new Trace(() -> "Running the book compiler for " + project)) {
            trace.use();
            final var builder = new ProcessBuilder(commandLine(request));
            builder.directory(project.root().toFile());
            builder.redirectErrorStream(true);
            final var environment = builder.environment();
            final var theme = request.themeDirectory();
            if (theme != null) {
                environment.put(themeVariable, theme.toAbsolutePath().toString());
            }
            final var endpoint = request.liveReloadEndpoint();
            if (endpoint != null) {
                environment.put(liveReloadVariable, endpoint);
            }

            final Path log;
            try {
                log = Files.createTempFile(logPrefix, logSuffix);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            try {
                builder.redirectOutput(log.toFile());
                final var exitCode = runToCompletion(builder, project);
                if (exitCode != 0) {
                    throw ConditionContext.error(new BookCompilerFailedCondition(
                        project.relativeRoot(),
                        "The book compiler exited with status " + exitCode,
                        readLog(log, project)
                    ));
                }
            } finally {
                try {
                    Files.deleteIfExists(log);
                } catch (final IOException e) {
                    ConditionContext.signalSuppressedException(e);
                }
            }
        }
    }

    // Output goes to a file so that waitFor() is the only blocking call.
    private static int runToCompletion(final ProcessBuilder builder, final BookProject project) {
        final Process process;
        try {
            process = builder.start();
        } catch (final IOException e) {
            throw ConditionContext.error(cannotRun(project, e));
        }
        try {
            process.getOutputStream().close();
            return process.waitFor();
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            throw SneakyThrow.doThrow(e);
        } catch (final IOException e) {
            process.destroyForcibly();
            throw ConditionContext.error(cannotRun(project, e));
        }
    }

    private static String readLog(final Path log, final BookProject project) {
        try {
            return new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw ConditionContext.error(new BookCompilerFailedCondition(
                project.relativeRoot(),
                "Cannot read the book compiler's output: " + e.getMessage(),
                null
            ));
        }
    }

    private static BookCompilerFailedCondition cannotRun(final BookProject project, final IOException e) {
        return new BookCompilerFailedCondition(
            project.relativeRoot(),
            "Cannot run the book compiler: " + e.getMessage(),
            null
        );
    }

    /**
     * Substitutes the placeholders of the command template.
     */
    static List<String> commandLine(final BookRequest request) {
        final var result = new ArrayList<String>(request.command().size());
        final var source = request.project().root().toAbsolutePath().toString();
        final var output = request.outputDirectory().toAbsolutePath().toString();
        for (final var argument : request.command()) {
            result.add(argument.replace(sourcePlaceholder, source).replace(outputPlaceholder, output));
        }
        return result;
    }

    static final String themeVariable = "MDBOOK_OUTPUT__HTML__THEME";
    static final String liveReloadVariable = "MDBOOK_OUTPUT__HTML__LIVE_RELOAD_ENDPOINT";
    private static final String sourcePlaceholder = "{source}";
    private static final String outputPlaceholder = "{output}";
    private static final String logPrefix = "kiln-book-";
    private static final String logSuffix = ".log";
}
