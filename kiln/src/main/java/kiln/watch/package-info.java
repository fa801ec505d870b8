// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Live mode: watching sources and scheduling rebuilds.
 */
@NonNullByDefault
package kiln.watch;

import kiln.util.annotation.NonNullByDefault;
