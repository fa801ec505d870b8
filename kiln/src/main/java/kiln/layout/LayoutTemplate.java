// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.layout;

import java.nio.file.Path;

/**
 * One layout of a chain.
 *
 * @param relativePath The layout template relative to the source root.
 * @param stamp        The newest modification time of the template and its configuration.
 */
public record LayoutTemplate(Path relativePath, long stamp) {
}
