// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Project settings.
 */
@NonNullByDefault
package kiln.config;

import kiln.util.annotation.NonNullByDefault;
