// file: src/main/java/io/pagelite/core/seed/BundledSeedSource.java
package io.pagelite.core.seed;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystem;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.FileSystems;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Seeds shipped inside the application, under a classpath directory.
 * <p>
 * The directory may be exploded on disk (IDE, tests) or packed in a jar; jars
 * are read through the zip file system, which stays open until {@link #close()}
 * so the returned {@link SeedFile}s can be read lazily.
 */
public final class BundledSeedSource implements SeedSource, AutoCloseable {
    public static final String DEFAULT_ROOT = "static";

    private final ClassLoader loader;
    private final String root;
    private FileSystem jarFs; // only set when we opened it

    public BundledSeedSource() {
        this(BundledSeedSource.class.getClassLoader(), DEFAULT_ROOT);
    }

    public BundledSeedSource(ClassLoader loader, String root) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public synchronized List<SeedFile> files() throws IOException {
        URL url = loader.getResource(root);
        if (url == null) {
            throw new NoSuchFileException(root, null, "bundled seed directory not on classpath");
        }
        URI uri;
        try {
            uri = url.toURI();
        } catch (URISyntaxException e) {
            throw new IOException("unusable resource URL " + url, e);
        }
        return new DirectorySeedSource(resolve(uri)).files();
    }

    private Path resolve(URI uri) throws IOException {
        if (!"jar".equalsIgnoreCase(uri.getScheme())) {
            return Path.of(uri);
        }
        FileSystem fs;
        try {
            fs = FileSystems.getFileSystem(uri);
        } catch (FileSystemNotFoundException notOpenYet) {
            jarFs = FileSystems.newFileSystem(uri, Map.of());
            fs = jarFs;
        }
        return fs.getPath("/" + root);
    }

    @Override
    public synchronized void close() throws IOException {
        if (jarFs != null) {
            jarFs.close();
            jarFs = null;
        }
    }

    @Override
    public String toString() {
        return "classpath:" + root;
    }
}
