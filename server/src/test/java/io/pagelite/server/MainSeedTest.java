// file: src/test/java/io/pagelite/server/MainSeedTest.java
package io.pagelite.server;

import io.pagelite.core.PageConfigRepository;
import io.pagelite.core.seed.SeedReport;
import io.pagelite.storage.LmdbKeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Startup seeding as wired by {@link Main}.
 */
class MainSeedTest {

    @TempDir Path dir;

    private LmdbKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = LmdbKeyValueStore.open(dir.resolve("seed.db"));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void bundled_pages_are_loaded_and_the_template_is_not() {
        var cfg = ServerConfig.parse(new String[0], Map.of());

        SeedReport report = Main.seed(store, cfg);

        assertEquals(List.of("hello.json", "index.json"), report.loaded());
        assertFalse(report.hasFailures());
        assertTrue(store.get("index").isPresent());
        assertTrue(store.get("hello").isPresent());
        assertTrue(store.get("amis").isEmpty());
        assertEquals(2, store.count());
    }

    @Test
    void bundled_index_page_is_served_instead_of_the_fallback() {
        Main.seed(store, ServerConfig.parse(new String[0], Map.of()));

        var pages = new PageConfigRepository(store);
        String index = new String(pages.get(WebServer.INDEX_PAGE), StandardCharsets.UTF_8);
        assertTrue(index.contains("/config/list"), index);
    }

    @Test
    void seed_dir_replaces_the_bundled_set() throws Exception {
        Path seeds = Files.createDirectory(dir.resolve("seeds"));
        Files.writeString(seeds.resolve("landing.json"), "{\"type\":\"page\",\"title\":\"landing\"}");
        Files.writeString(seeds.resolve("empty.json"), "");

        var cfg = ServerConfig.parse(new String[]{"--seed-dir", seeds.toString()}, Map.of());
        SeedReport report = Main.seed(store, cfg);

        assertEquals(List.of("landing.json"), report.loaded());
        assertEquals(1, report.failures().size());
        assertEquals("empty.json", report.failures().get(0).fileName());
        assertTrue(store.get("landing").isPresent());
        assertTrue(store.get("index").isEmpty());
    }

    @Test
    void missing_seed_dir_is_reported_and_nothing_is_written() {
        var cfg = ServerConfig.parse(new String[]{"--seed-dir", dir.resolve("nope").toString()}, Map.of());

        SeedReport report = Main.seed(store, cfg);

        assertTrue(report.loaded().isEmpty());
        assertTrue(report.hasFailures());
        assertEquals(0, store.count());
    }
}
