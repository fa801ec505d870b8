// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.tomlj.Toml;

/**
 * Loads TOML fragments. Never signals: failures end up in the returned {@link ConfigFragment}.
 */
public final class FragmentLoader {
    private FragmentLoader() {
    }

    /**
     * Loads the fragment at the given path, or returns {@code null} if there is no such file.
     */
    public static @Nullable ConfigFragment loadIfExists(final Path sourceRoot, final Path relativeFile) {
        final var file = sourceRoot.resolve(relativeFile);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            final var modified = Files.getLastModifiedTime(file).toMillis();
            return parse(relativeFile, Files.readString(file), modified);
        } catch (final IOException e) {
            return new ConfigFragment(relativeFile, null, "Cannot read the fragment: " + e.getMessage(), 0);
        }
    }

    /**
     * Parses fragment text that was already read, such as front matter.
     */
    public static ConfigFragment parse(final Path relativeFile, final String text, final long modified) {
        final var result = Toml.parse(text);
        if (result.hasErrors()) {
            return new ConfigFragment(relativeFile, null, TomlValues.describeErrors(result), modified);
        }
        return new ConfigFragment(relativeFile, TomlValues.toTable(result), null, modified);
    }
}
