// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.livereload;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;

/**
 * The browser side of live reload: a script and its stylesheet written to the destination root of live builds.
 */
public final class ReloadScript {
    private ReloadScript() {
    }

    /**
     * Writes the script, connecting to the given endpoint, and its stylesheet into the destination root.
     * Signals a fatal {@link IOExceptionCondition} if either cannot be written.
     */
    public static void write(final Path destinationRoot, final String endpoint) {
        try (final var trace = new Trace("Writing the live reload script")) {
            trace.use();
            try {
                Files.createDirectories(destinationRoot);
                final var script = resource(scriptResource).replace(endpointPlaceholder, endpoint);
                Files.writeString(destinationRoot.resolve(fileName), script, StandardCharsets.UTF_8);
                Files.writeString(destinationRoot.resolve(stylesheetFileName), resource(stylesheetResource));
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    /**
     * Removes the script and stylesheet left behind by an earlier live build.
     */
    public static void remove(final Path destinationRoot) {
        try {
            Files.deleteIfExists(destinationRoot.resolve(fileName));
            Files.deleteIfExists(destinationRoot.resolve(stylesheetFileName));
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private static String resource(final String name) throws IOException {
        try (final InputStream stream = ReloadScript.class.getResourceAsStream(name)) {
            if (stream == null) {
                throw new IOException("Missing resource " + name);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static final String fileName = "__livereload.js";
    public static final String stylesheetFileName = "__livereload.css";
    private static final String scriptResource = "livereload.js";
    private static final String stylesheetResource = "livereload.css";
    private static final String endpointPlaceholder = "@ENDPOINT@";
}
