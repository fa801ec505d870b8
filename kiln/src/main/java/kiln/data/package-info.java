// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Page data: TOML fragments, front matter and the merged per-document context.
 */
@NonNullByDefault
package kiln.data;

import kiln.util.annotation.NonNullByDefault;
