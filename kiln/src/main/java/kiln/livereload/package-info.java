// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The live reload server: static files from the destination tree plus a WebSocket endpoint that pushes build
 * events to browsers.
 */
@NonNullByDefault
package kiln.livereload;

import kiln.util.annotation.NonNullByDefault;
