// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Output path planning.
 */
@NonNullByDefault
package kiln.destination;

import kiln.util.annotation.NonNullByDefault;
