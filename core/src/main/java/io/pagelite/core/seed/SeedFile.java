// file: src/main/java/io/pagelite/core/seed/SeedFile.java
package io.pagelite.core.seed;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One bundled file offered for seeding.
 */
public interface SeedFile {

    /** Bare file name, without directories (e.g. "index.json"). */
    String fileName();

    /** Read the whole payload. */
    byte[] read() throws IOException;

    static SeedFile of(Path path) {
        String fileName = path.getFileName().toString();
        return new SeedFile() {
            @Override
            public String fileName() {
                return fileName;
            }

            @Override
            public byte[] read() throws IOException {
                return Files.readAllBytes(path);
            }

            @Override
            public String toString() {
                return path.toString();
            }
        };
    }
}
