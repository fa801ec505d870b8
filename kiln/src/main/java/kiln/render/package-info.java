// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Document rendering with Mustache templates and Markdown.
 */
@NonNullByDefault
package kiln.render;

import kiln.util.annotation.NonNullByDefault;
