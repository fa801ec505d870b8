// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.render;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheResolver;
import kiln.source.SourceConventions;
import kiln.util.PathUtils;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The template engine of one build pass.
 * <p>
 * Partials, {@code {{> name}}}, are looked up as {@code templates/name.mustache} under the source root regardless
 * of which template includes them. Layouts are compiled once per pass and shared between threads; document
 * templates are compiled for each render.
 */
public final class TemplateEngine {
    public TemplateEngine(final Path sourceRoot) {
        factory = new SourceMustacheFactory(sourceRoot);
    }

    /**
     * Compiles the text of a document. Throws {@link MustacheException} on syntax errors.
     */
    Mustache document(final String text, final Path document) {
        return factory.compile(new StringReader(text), PathUtils.toPortableString(document));
    }

    /**
     * Returns the compiled layout at the given path relative to the source root. Throws {@link MustacheException}
     * if it is missing or malformed.
     */
    Mustache layout(final Path layout) {
        return factory.compile(PathUtils.toPortableString(layout));
    }

    private final SourceMustacheFactory factory;

    private static final class SourceMustacheFactory extends DefaultMustacheFactory {
        private SourceMustacheFactory(final Path sourceRoot) {
            super(new SourceResolver(sourceRoot));
        }

        @Override
        public String resolvePartialPath(final String dir, final String name, final String extension) {
            return SourceConventions.templatesDirectoryName + '/' + name + '.' + SourceConventions.templateExtension;
        }
    }

    private static final class SourceResolver implements MustacheResolver {
        private SourceResolver(final Path sourceRoot) {
            this.sourceRoot = sourceRoot.toAbsolutePath().normalize();
        }

        @Override
        public @Nullable Reader getReader(final String resourceName) {
            final var path = sourceRoot.resolve(resourceName).normalize();
            if (!path.startsWith(sourceRoot) || !Files.isRegularFile(path)) {
                return null;
            }
            try {
                return Files.newBufferedReader(path, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw new MustacheException("Cannot read template " + resourceName, e);
            }
        }

        private final Path sourceRoot;
    }
}
