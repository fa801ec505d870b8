// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.redirect;

import java.nio.file.Path;
import kiln.config.SiteSettings;
import kiln.source.SourceCondition;
import kiln.util.PathUtils;

/**
 * A condition type indicating that a redirect page would overwrite a file it does not own. Only the redirect fails;
 * the file is left alone.
 */
public final class RedirectCollisionCondition extends SourceCondition {
    RedirectCollisionCondition(final Redirect redirect, final String occupant) {
        super(
            Path.of(SiteSettings.settingsFileName),
            "Redirect " + redirect.from() + " would overwrite " + PathUtils.toPortableString(redirect.destination())
                + ", " + occupant
        );
        this.redirect = redirect;
    }

    public Redirect redirect() {
        return redirect;
    }

    private final Redirect redirect;
}
