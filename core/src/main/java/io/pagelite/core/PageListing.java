// file: src/main/java/io/pagelite/core/PageListing.java
package io.pagelite.core;

import java.util.List;

/**
 * Result of {@link PageConfigRepository#list()}: entries in name order plus their count.
 */
public record PageListing(List<PageEntry> items, int total) {

    public PageListing {
        items = List.copyOf(items);
        if (total != items.size()) {
            throw new IllegalArgumentException("total " + total + " != items " + items.size());
        }
    }

    public static PageListing of(List<PageEntry> items) {
        return new PageListing(items, items.size());
    }
}
