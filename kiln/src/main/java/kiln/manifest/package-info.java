// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The build manifest that makes incremental builds possible.
 */
@NonNullByDefault
package kiln.manifest;

import kiln.util.annotation.NonNullByDefault;
