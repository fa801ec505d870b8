// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.nio.file.Path;
import java.util.List;
import kiln.config.SiteSettings;
import kiln.destination.DestinationPlanner;
import kiln.destination.UrlPolicy;
import kiln.source.SourceConventions;
import kiln.source.SourceEntry;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the data of a document by layering, from lowest to highest precedence: the {@code [page]} table of
 * {@code site.toml}, every {@code data.toml} from the source root down to the document's directory, the document's
 * own {@code name.toml}, and finally its front matter.
 * <p>
 * Safe to use from several threads at once.
 */
public final class DataResolver {
    public DataResolver(final SiteSettings settings, final DirectoryCache cache, final DestinationPlanner planner) {
        sourceRoot = settings.sourceDirectory();
        globalPage = settings.page();
        this.cache = cache;
        this.planner = planner;
    }

    /**
     * Resolves the data of the given document.
     * <p>
     * Signals, as fatal conditions for the document: {@link MalformedFragmentCondition} if any fragment it inherits
     * is broken, {@link ReservedKeyCondition} if any fragment defines {@code context} or {@code template}, and
     * {@link kiln.destination.DestinationCollisionCondition} if another document claims the same output. Signals
     * {@link NonBooleanFlagCondition} warnings for malformed flags.
     */
    public ResolvedContext resolve(final SourceEntry document, final DocumentText text) {
        try (final var trace = new Trace(() -> "Resolving data of " + document)) {
            trace.use();
            final var path = document.relativePath();
            planner.checkCollision(path);

            checkReservedKeys(path, Path.of(SiteSettings.settingsFileName), globalPage);
            var data = globalPage;
            long stamp = 0;
            for (final var directory : cache.chain(document.relativeDirectory())) {
                final var fragment = directory.data();
                if (fragment != null) {
                    data = layer(path, data, fragment);
                    stamp = Math.max(stamp, fragment.modified());
                }
            }
            final var sidecarPath = PathUtils.changeExtension(path, SourceConventions.fragmentExtension);
            final var sidecar = isLayoutConfiguration(sidecarPath)
                ? null
                : FragmentLoader.loadIfExists(sourceRoot, sidecarPath);
            if (sidecar != null) {
                data = layer(path, data, sidecar);
                stamp = Math.max(stamp, sidecar.modified());
            }
            final var frontMatter = text.frontMatter();
            if (frontMatter != null) {
                data = layer(path, data, FragmentLoader.parse(path, frontMatter, document.modified()));
            }

            final var title = inferTitle(document, data);
            data = data.with(titleKey, new DataValue.Text(title));
            final var standalone = flag(path, data, standaloneKey);
            final var draft = flag(path, data, draftKey);
            final var cleanUrls = optionalFlag(path, data, cleanUrlsKey);
            final var policy = (cleanUrls == null) ? planner.defaultPolicy() : UrlPolicy.of(cleanUrls);
            final var destination = planner.plan(path, policy);
            return new ResolvedContext(document, data, title, standalone, draft, destination, stamp);
        }
    }

    // layout.toml next to layout.mustache configures the layout, even when a layout.md or layout.html sits there too.
    private boolean isLayoutConfiguration(final Path fragment) {
        return SourceConventions.layoutConfigFileName.equals(PathUtils.fileName(fragment))
            && cache.get(PathUtils.parentOf(fragment)).layout() != null;
    }

    private static DataValue.Table layer(
        final Path document,
        final DataValue.Table data,
        final ConfigFragment fragment
    ) {
        final var table = fragment.tableFor(document);
        checkReservedKeys(document, fragment.file(), table);
        return data.merge(table);
    }

    private static void checkReservedKeys(final Path document, final Path fragment, final DataValue.Table table) {
        for (final var key : reservedKeys) {
            if (table.containsKey(key)) {
                throw ConditionContext.error(new ReservedKeyCondition(document, fragment, key));
            }
        }
    }

    private String inferTitle(final SourceEntry document, final DataValue.Table data) {
        final var explicit = data.get(titleKey);
        if (explicit instanceof final DataValue.Text text) {
            return text.value();
        }
        if (explicit != null) {
            return String.valueOf(explicit.toTemplateValue());
        }
        if (!document.isIndex()) {
            return Titles.humanize(document.stem());
        }
        final var directory = document.relativeDirectory();
        final var directoryName = directory.toString().isEmpty()
            ? PathUtils.fileName(sourceRoot.toAbsolutePath().normalize())
            : PathUtils.fileName(directory);
        return Titles.humanize(directoryName);
    }

    private static boolean flag(final Path document, final DataValue.Table data, final String key) {
        final var value = optionalFlag(document, data, key);
        return value != null && value;
    }

    private static @Nullable Boolean optionalFlag(final Path document, final DataValue.Table data, final String key) {
        final var value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof final DataValue.Bool bool) {
            return bool.value();
        }
        ConditionContext.signal(new NonBooleanFlagCondition(document, key, value));
        return null;
    }

    /**
     * The key holding the rendered content when a layout is rendered.
     */
    public static final String templateKey = "template";
    /**
     * The key holding build information such as the tag and the output path.
     */
    public static final String contextKey = "context";
    public static final String layoutKey = "layout";
    static final String titleKey = "title";
    static final String standaloneKey = "standalone";
    static final String draftKey = "draft";
    static final String cleanUrlsKey = "clean_urls";
    private static final List<String> reservedKeys = List.of(contextKey, templateKey);

    private final Path sourceRoot;
    private final DataValue.Table globalPage;
    private final DirectoryCache cache;
    private final DestinationPlanner planner;
}
