// file: src/main/java/io/pagelite/core/seed/SeedFailure.java
package io.pagelite.core.seed;

/** A seed file that was skipped, and why. */
public record SeedFailure(String fileName, String error) {}
