// file: src/main/java/io/pagelite/core/seed/SeedSource.java
package io.pagelite.core.seed;

import java.io.IOException;
import java.util.List;

/**
 * A named, enumerable, read-only set of documents available at startup.
 * <p>
 * Contract:
 *  - files() returns the same order for the same content on every run.
 *  - Non-document files may be included; the loader filters by suffix.
 */
@FunctionalInterface
public interface SeedSource {

    List<SeedFile> files() throws IOException;
}
