// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Discovery and classification of the source tree.
 */
@NonNullByDefault
package kiln.source;

import kiln.util.annotation.NonNullByDefault;
