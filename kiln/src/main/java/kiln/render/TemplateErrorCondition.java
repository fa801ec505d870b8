// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.render;

import java.nio.file.Path;
import kiln.source.SourceCondition;
import kiln.util.PathUtils;

/**
 * A condition type indicating that a template used by a document failed to compile or to render.
 */
public final class TemplateErrorCondition extends SourceCondition {
    TemplateErrorCondition(final Path document, final Path template, final RuntimeException exception) {
        super(document, "Template error in " + PathUtils.toPortableString(template) + ": " + exception.getMessage());
        this.exception = exception;
    }

    @Override
    public String detailedMessage() {
        final var cause = exception.getCause();
        return (cause != null) ? (message() + "\nCaused by: " + cause) : message();
    }

    private final RuntimeException exception;
}
