// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Layout chain resolution.
 */
@NonNullByDefault
package kiln.layout;

import kiln.util.annotation.NonNullByDefault;
