// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities without a better home.
 */
@NonNullByDefault
package kiln.util;

import kiln.util.annotation.NonNullByDefault;
