// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.manifest;

/**
 * What the manifest remembers about one source after it was built.
 *
 * @param source       The source path relative to the source root, with forward slashes.
 * @param modified     The source's modification time when it was built, in epoch milliseconds.
 * @param destination  The output path relative to the destination root, with forward slashes.
 * @param dependencies The dependency stamp when it was built: the newest modification time of the data fragments,
 *                     layouts and partials the output depends on.
 */
public record ManifestEntry(String source, long modified, String destination, long dependencies) {
}
