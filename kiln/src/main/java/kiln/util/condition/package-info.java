// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system in the style of Common Lisp, used for all error reporting during a build.
 */
@NonNullByDefault
package kiln.util.condition;

import kiln.util.annotation.NonNullByDefault;
