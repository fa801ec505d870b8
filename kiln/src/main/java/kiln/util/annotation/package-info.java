// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Static analysis annotations shared by the whole project.
 */
package kiln.util.annotation;
