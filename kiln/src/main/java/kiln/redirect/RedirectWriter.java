// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.redirect;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import kiln.manifest.BuildManifest;
import kiln.manifest.ManifestEntry;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import kiln.util.condition.exception.IOExceptionCondition;

/**
 * Writes redirect pages into the destination root and tracks them in the build manifest.
 * <p>
 * A redirect never replaces another source's output, nor a file that is not a redirect page; either signals a
 * {@link RedirectCollisionCondition}.
 */
public final class RedirectWriter {
    /**
     * Initializes a writer recording into the given manifest.
     *
     * @param manifest      The manifest of the pass.
     * @param settingsStamp The modification time of {@code site.toml}, where the redirects are declared.
     */
    public RedirectWriter(final BuildManifest manifest, final long settingsStamp) {
        this.manifest = manifest;
        this.settingsStamp = settingsStamp;
    }

    /**
     * Writes the page of one redirect unless it is up to date.
     *
     * @param liveSources The sources whose outputs the pass keeps, used to find the owner of the destination.
     * @return Whether the page was written.
     */
    public boolean write(final Redirect redirect, final Set<String> liveSources) {
        try (final var trace = new Trace(() -> "Writing the redirect from " + redirect.from())) {
            trace.use();
            final var destination = PathUtils.toPortableString(redirect.destination());
            final var claimant = manifest.claimant(destination, liveSources, redirect.manifestKey());
            if (claimant != null) {
                throw ConditionContext.error(new RedirectCollisionCondition(redirect, "the output of " + claimant));
            }
            final var entry = new ManifestEntry(redirect.manifestKey(), settingsStamp, destination, 0);
            if (!manifest.isStale(entry)) {
                return false;
            }
            final var target = manifest.destinationRoot().resolve(redirect.destination().toString());
            if (Files.exists(target) && !isRedirectPage(target)) {
                throw ConditionContext.error(new RedirectCollisionCondition(redirect, "which already exists"));
            }
            Files.createDirectories(target.getParent());
            Files.writeString(target, page(redirect.to()), StandardCharsets.UTF_8);
            manifest.record(entry);
            return true;
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    /**
     * Renders the page sending browsers and crawlers to the given location.
     */
    static String page(final String location) {
        final var escaped = location.replace("&", "&amp;");
        return pagePrefix
            + "<link rel=\"canonical\" href=\"" + escaped + "\">"
            + "<noscript><meta http-equiv=\"refresh\" content=\"0; url=" + escaped + "\"></noscript>"
            + "</head><body onload=\"document.location.replace('" + escaped + "');\"></body></html>\n";
    }

    private static boolean isRedirectPage(final Path file) throws IOException {
        if (!Files.isRegularFile(file) || Files.size(file) > maxPageSize) {
            return false;
        }
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8).startsWith(pagePrefix);
    }

    private final BuildManifest manifest;
    private final long settingsStamp;

    private static final String pagePrefix =
        "<!doctype html><html><head><meta charset=\"utf-8\"><meta name=\"generator\" content=\"kiln redirect\">";
    private static final long maxPageSize = 8192;
}
