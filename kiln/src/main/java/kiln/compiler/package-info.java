// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The build pass: everything from loading the settings to saving the manifest.
 */
@NonNullByDefault
package kiln.compiler;

import kiln.util.annotation.NonNullByDefault;
