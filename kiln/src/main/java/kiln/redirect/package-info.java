// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Redirect pages for URLs that moved, declared in the {@code [redirect]} table of {@code site.toml}.
 */
@NonNullByDefault
package kiln.redirect;

import kiln.util.annotation.NonNullByDefault;
