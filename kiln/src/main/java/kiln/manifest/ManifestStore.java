// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import kiln.config.BuildTag;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads and writes {@code .kiln-manifest.json} at the root of a destination directory.
 * <p>
 * The file looks like
 * {@code {"version":1,"tag":"debug","entries":[{"source":..,"modified":..,"destination":..,"dependencies":..}]}}.
 */
public final class ManifestStore {
    private ManifestStore() {
    }

    /**
     * Loads the manifest of the given tag, or an empty one if there is none yet.
     * <p>
     * A manifest of another version or tag is discarded with a {@link ManifestVersionCondition} warning. A manifest
     * that is not valid JSON is a fatal {@link ManifestCorruptCondition}, or just a warning in force mode.
     */
    public static BuildManifest load(final Path destinationRoot, final BuildTag tag, final boolean force) {
        final var path = destinationRoot.resolve(fileName);
        try (final var trace = new Trace(() -> "Loading build manifest " + path)) {
            trace.use();
            if (!Files.isRegularFile(path)) {
                return new BuildManifest(tag, destinationRoot, force, List.of());
            }
            final ManifestFile file;
            try {
                file = mapper.readValue(path.toFile(), ManifestFile.class);
            } catch (final JsonProcessingException e) {
                final var condition = new ManifestCorruptCondition(path, e.getOriginalMessage());
                return discardCorrupt(destinationRoot, tag, force, condition);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            if (file.version() != currentVersion || !tag.directoryName().equals(file.tag())) {
                ConditionContext.signal(new ManifestVersionCondition(
                    path,
                    "version " + file.version() + ", tag " + file.tag()
                ));
                return new BuildManifest(tag, destinationRoot, force, List.of());
            }
            final var entries = file.entries();
            if (entries == null) {
                return new BuildManifest(tag, destinationRoot, force, List.of());
            }
            for (int i = 0; i < entries.size(); i += 1) {
                final var problem = validate(entries.get(i));
                if (problem != null) {
                    return discardCorrupt(
                        destinationRoot,
                        tag,
                        force,
                        new ManifestCorruptCondition(path, "entry " + i + " " + problem)
                    );
                }
            }
            return new BuildManifest(tag, destinationRoot, force, entries);
        }
    }

    private static BuildManifest discardCorrupt(
        final Path destinationRoot,
        final BuildTag tag,
        final boolean force,
        final ManifestCorruptCondition condition
    ) {
        if (!force) {
            throw ConditionContext.error(condition);
        }
        ConditionContext.signal(condition);
        return new BuildManifest(tag, destinationRoot, true, List.of());
    }

    // Jackson leaves missing members of a record null regardless of the declared nullness.
    @SuppressWarnings("ConstantConditions")
    private static @Nullable String validate(final @Nullable ManifestEntry entry) {
        if (entry == null) {
            return "is null";
        }
        if (entry.source() == null || entry.source().isEmpty()) {
            return "has no source";
        }
        if (entry.destination() == null) {
            return "has no destination";
        }
        return null;
    }

    /**
     * Writes the manifest, replacing the previous file atomically.
     */
    public static void save(final BuildManifest manifest) {
        final var path = manifest.destinationRoot().resolve(fileName);
        try (final var trace = new Trace(() -> "Saving build manifest " + path)) {
            trace.use();
            final var file = new ManifestFile(currentVersion, manifest.tag().directoryName(), manifest.entries());
            final var temporary = path.resolveSibling(fileName + ".tmp");
            try {
                Files.createDirectories(manifest.destinationRoot());
                mapper.writeValue(temporary.toFile(), file);
                Files.move(temporary, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
        }
    }

    public static final String fileName = ".kiln-manifest.json";
    static final int currentVersion = 1;

    private static final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    record ManifestFile(int version, @Nullable String tag, @Nullable List<@Nullable ManifestEntry> entries) {
    }
}
