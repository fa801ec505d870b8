// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.layout;

import java.util.List;

/**
 * The layouts a document is wrapped in, nearest first.
 */
public record LayoutChain(List<LayoutTemplate> layouts) {
    public LayoutChain {
        layouts = List.copyOf(layouts);
    }

    public static LayoutChain empty() {
        return emptyChain;
    }

    /**
     * The newest modification time among the layouts and their configuration, or zero for an empty chain.
     */
    public long stamp() {
        long result = 0;
        for (final var layout : layouts) {
            result = Math.max(result, layout.stamp());
        }
        return result;
    }

    private static final LayoutChain emptyChain = new LayoutChain(List.of());
}
