// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line entry point.
 */
@NonNullByDefault
package kiln.cli;

import kiln.util.annotation.NonNullByDefault;
