// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Delegation of book subtrees to an external book compiler such as mdBook.
 */
@NonNullByDefault
package kiln.book;

import kiln.util.annotation.NonNullByDefault;
