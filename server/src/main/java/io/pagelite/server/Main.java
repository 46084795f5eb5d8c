// file: src/main/java/io/pagelite/server/Main.java
package io.pagelite.server;

import io.pagelite.core.PageConfigRepository;
import io.pagelite.core.seed.BundledSeedSource;
import io.pagelite.core.seed.DirectorySeedSource;
import io.pagelite.core.seed.SeedFailure;
import io.pagelite.core.seed.SeedLoader;
import io.pagelite.core.seed.SeedReport;
import io.pagelite.storage.LmdbKeyValueStore;
import io.pagelite.storage.StorageUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a pagelite server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI/env.
 *  - Open the store (the one handle for this process) and seed it.
 *  - Wire the repository into the HTTP layer and start it.
 *  - Close everything on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage Layer -------
        LmdbKeyValueStore store;
        try {
            store = LmdbKeyValueStore.open(Path.of(cfg.dbPath()), cfg.storeOptions());
            seed(store, cfg);
        } catch (StorageUnavailableException e) {
            log.log(Level.SEVERE, "store unavailable: " + cfg.dbPath(), e);
            System.exit(1);
            return;
        }

        // ------ HTTP layer ------
        var pages = new PageConfigRepository(store);
        var web = new WebServer(cfg.host(), cfg.httpPort(), cfg.workerThreads(),
                pages, PageRenderer.fromClasspath());
        web.start();

        log.info(String.format("pagelite listening on http://%s:%d (store %s)",
                cfg.host(), web.port(), store.path()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                store.close();
                log.info("store closed");
            }
        }, "pagelite-shutdown"));
    }

    static SeedReport seed(LmdbKeyValueStore store, ServerConfig cfg) {
        var loader = new SeedLoader(store);
        SeedReport report;
        if (cfg.seedDir() != null) {
            report = loader.load(new DirectorySeedSource(Path.of(cfg.seedDir())));
        } else {
            var bundled = new BundledSeedSource();
            try {
                report = loader.load(bundled);
            } finally {
                try {
                    bundled.close();
                } catch (IOException e) {
                    log.log(Level.WARNING, "cannot close bundled seed source", e);
                }
            }
        }

        for (SeedFailure f : report.failures()) {
            log.warning("seed skipped: " + f.fileName() + " (" + f.error() + ")");
        }
        log.info(String.format("seeded %d page(s), %d skipped",
                report.loaded().size(), report.failures().size()));
        return report;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "cannot read logging.properties, using JDK defaults", e);
        }
    }
}
