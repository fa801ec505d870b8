// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.render;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import kiln.config.BuildTag;
import kiln.data.DataResolver;
import kiln.data.DocumentText;
import kiln.data.ResolvedContext;
import kiln.layout.LayoutChain;
import kiln.util.PathUtils;
import kiln.util.Trace;
import kiln.util.condition.ConditionContext;

/**
 * Renders documents: Markdown conversion, the template pass over the document, then each layout of its chain.
 * <p>
 * Every template sees the document's data, the block helpers, and a {@code context} table with the build's
 * {@code tag}, whether it is {@code live}, and the document's {@code source} and {@code destination} paths.
 * Layouts additionally see the content rendered so far as {@code template}, to be included with
 * {@code {{{template}}}}.
 * <p>
 * Thread-safe.
 */
public final class Renderer {
    public Renderer(final TemplateEngine engine, final BuildTag tag, final boolean live) {
        this.engine = engine;
        this.tag = tag;
        this.live = live;
    }

    /**
     * Renders a document to its final bytes.
     * <p>
     * Signals a fatal {@link TemplateErrorCondition} if any template involved fails to compile or render.
     */
    public byte[] render(final ResolvedContext context, final LayoutChain chain, final DocumentText text) {
        final var document = context.document();
        try (final var trace = new Trace(() -> "Rendering " + document)) {
            trace.use();
            final var scope = new HashMap<String, Object>(TemplateHelpers.all());
            scope.putAll(context.data().toTemplateValue());
            scope.put(DataResolver.contextKey, buildContext(context));

            final var source = document.isMarkdown()
                ? MarkdownConverter.toHtmlTemplate(text.body())
                : text.body();
            var content = execute(
                document.relativePath(),
                document.relativePath(),
                () -> engine.document(source, document.relativePath()),
                scope
            );
            for (final var layout : chain.layouts()) {
                final var inner = content;
                try (final var layoutTrace = new Trace(() -> "Applying layout " + layout.relativePath())) {
                    layoutTrace.use();
                    scope.put(DataResolver.templateKey, inner);
                    content = execute(
                        document.relativePath(),
                        layout.relativePath(),
                        () -> engine.layout(layout.relativePath()),
                        scope
                    );
                }
            }
            if (live) {
                content = LiveReloadInjector.inject(content);
            }
            return content.getBytes(StandardCharsets.UTF_8);
        }
    }

    private Map<String, Object> buildContext(final ResolvedContext context) {
        final var result = new LinkedHashMap<String, Object>();
        result.put("tag", tag.directoryName());
        result.put("live", live);
        result.put("source", context.document().key());
        result.put("destination", PathUtils.toPortableString(context.destination()));
        return result;
    }

    private static String execute(
        final Path document,
        final Path template,
        final Supplier<Mustache> compiler,
        final Map<String, Object> scope
    ) {
        try {
            final var writer = new StringWriter();
            compiler.get().execute(writer, scope).flush();
            return writer.toString();
        } catch (final MustacheException e) {
            throw ConditionContext.error(new TemplateErrorCondition(document, template, e));
        } catch (final IOException e) {
            throw ConditionContext.error(new TemplateErrorCondition(document, template, new UncheckedIOException(e)));
        }
    }

    private final TemplateEngine engine;
    private final BuildTag tag;
    private final boolean live;
}
