// file: src/main/java/io/pagelite/core/seed/SeedReport.java
package io.pagelite.core.seed;

import java.util.List;

/**
 * Outcome of one {@link SeedLoader#load(SeedSource)} run.
 *
 * @param loaded   file names written to the store, in enumeration order
 * @param failures files that were skipped
 */
public record SeedReport(List<String> loaded, List<SeedFailure> failures) {

    public SeedReport {
        loaded = List.copyOf(loaded);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
