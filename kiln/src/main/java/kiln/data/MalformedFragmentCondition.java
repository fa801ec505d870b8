// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.data;

import java.nio.file.Path;
import kiln.source.SourceCondition;
import kiln.util.PathUtils;

/**
 * A condition type indicating that a data fragment a document depends on is not valid TOML.
 * <p>
 * Signaled once per affected document: a broken {@code data.toml} fails every document beneath its directory.
 */
public final class MalformedFragmentCondition extends SourceCondition {
    public MalformedFragmentCondition(final Path document, final Path fragment, final String error) {
        super(document, "Malformed data fragment " + PathUtils.toPortableString(fragment));
        this.fragment = fragment;
        this.error = error;
    }

    /**
     * The broken fragment, relative to the source root.
     */
    public Path fragment() {
        return fragment;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + error;
    }

    private final Path fragment;
    private final String error;
}
