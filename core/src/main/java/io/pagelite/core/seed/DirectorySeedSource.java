// file: src/main/java/io/pagelite/core/seed/DirectorySeedSource.java
package io.pagelite.core.seed;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Seeds read from a directory tree, sorted by path relative to the root.
 * Works on any {@link java.nio.file.FileSystem}, including the zip file system
 * used by {@link BundledSeedSource} for jars.
 */
public final class DirectorySeedSource implements SeedSource {
    private final Path root;

    public DirectorySeedSource(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public List<SeedFile> files() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "seed directory does not exist");
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> root.relativize(p).toString()))
                    .map(SeedFile::of)
                    .toList();
        }
    }

    @Override
    public String toString() {
        return "dir:" + root;
    }
}
