// file: src/test/java/io/pagelite/storage/LmdbKeyValueStoreTest.java
package io.pagelite.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LmdbKeyValueStoreTest {

    @TempDir Path dir;

    private LmdbKeyValueStore store;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private LmdbKeyValueStore openStore() {
        store = LmdbKeyValueStore.open(dir.resolve("pages.db"));
        return store;
    }

    @AfterEach
    void closeStore() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    void put_then_get_returns_identical_bytes() {
        var s = openStore();
        byte[] doc = b("{\"type\":\"page\",\"title\":\"héllo\"}");

        s.put("home", doc);

        assertArrayEquals(doc, s.get("home").orElseThrow());
    }

    @Test
    void missing_key_is_absent_not_an_error() {
        var s = openStore();

        assertTrue(s.get("nope").isEmpty());
        assertTrue(s.get("").isEmpty());
        assertTrue(s.get(null).isEmpty());
    }

    @Test
    void put_overwrites_existing_value() {
        var s = openStore();
        s.put("k", b("1"));
        s.put("k", b("2"));

        assertArrayEquals(b("2"), s.get("k").orElseThrow());
        assertEquals(1, s.count());
    }

    @Test
    void put_with_empty_name_is_rejected() {
        var s = openStore();

        assertThrows(NameEmptyException.class, () -> s.put("", b("{}")));
        assertThrows(NameEmptyException.class, () -> s.put(null, b("{}")));
        assertEquals(0, s.count());
    }

    @Test
    void put_with_oversized_name_is_rejected() {
        var s = openStore();
        String longName = "x".repeat(600);

        assertThrows(IllegalArgumentException.class, () -> s.put(longName, b("{}")));
        assertTrue(s.get(longName).isEmpty());
    }

    @Test
    void delete_is_idempotent() {
        var s = openStore();
        s.put("a", b("1"));
        s.put("b", b("2"));

        s.delete("a");
        s.delete("a");
        s.delete("never-existed");

        assertTrue(s.get("a").isEmpty());
        assertArrayEquals(b("2"), s.get("b").orElseThrow());
        assertEquals(1, s.count());
    }

    @Test
    void delete_with_empty_name_is_rejected() {
        var s = openStore();

        assertThrows(NameEmptyException.class, () -> s.delete(""));
    }

    @Test
    void for_each_visits_entries_in_lexicographic_order() {
        var s = openStore();
        s.put("zeta", b("z"));
        s.put("Alpha", b("A"));
        s.put("alpha", b("a"));
        s.put("beta", b("b"));
        s.put("alpha2", b("a2"));

        List<String> names = new ArrayList<>();
        s.forEach((name, value) -> names.add(name));

        // byte order: upper case before lower case, prefixes first
        assertEquals(List.of("Alpha", "alpha", "alpha2", "beta", "zeta"), names);
    }

    @Test
    void put_all_commits_every_entry_and_last_duplicate_wins() {
        var s = openStore();

        s.putAll(List.of(
                new KeyValueStore.Entry("one", b("1")),
                new KeyValueStore.Entry("two", b("2")),
                new KeyValueStore.Entry("one", b("1b"))
        ));

        assertEquals(2, s.count());
        assertArrayEquals(b("1b"), s.get("one").orElseThrow());
        assertArrayEquals(b("2"), s.get("two").orElseThrow());
    }

    @Test
    void put_all_with_an_invalid_name_commits_nothing() {
        var s = openStore();
        s.put("keep", b("old"));

        assertThrows(NameEmptyException.class, () -> s.putAll(List.of(
                new KeyValueStore.Entry("keep", b("new")),
                new KeyValueStore.Entry("", b("bad"))
        )));

        assertArrayEquals(b("old"), s.get("keep").orElseThrow());
        assertEquals(1, s.count());
    }

    @Test
    void entries_survive_reopen() {
        var s = openStore();
        s.put("home", b("{\"v\":1}"));
        s.close();

        var reopened = openStore();

        assertArrayEquals(b("{\"v\":1}"), reopened.get("home").orElseThrow());
    }

    @Test
    void second_open_of_same_file_fails() {
        openStore();

        assertThrows(StorageUnavailableException.class,
                () -> LmdbKeyValueStore.open(dir.resolve("pages.db")));
        // relative spelling of the same file is the same claim
        assertThrows(StorageUnavailableException.class,
                () -> LmdbKeyValueStore.open(dir.resolve("sub/../pages.db")));
    }

    @Test
    void path_can_be_reopened_after_close() {
        openStore().close();

        assertDoesNotThrow(this::openStore);
    }

    @Test
    void open_fails_when_parent_is_a_regular_file() throws Exception {
        Path blocker = Files.writeString(dir.resolve("blocker"), "not a directory");
        Path target = blocker.resolve("pages.db");

        assertThrows(StorageUnavailableException.class, () -> LmdbKeyValueStore.open(target));

        // the failed attempt must not keep the path claimed
        Files.delete(blocker);
        store = LmdbKeyValueStore.open(target);
        assertNotNull(store);
    }

    @Test
    void store_file_is_owner_read_write_only() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        var s = openStore();

        Set<PosixFilePermission> perms = Files.getPosixFilePermissions(s.path());

        assertTrue(perms.contains(PosixFilePermission.OWNER_READ));
        assertTrue(perms.contains(PosixFilePermission.OWNER_WRITE));
        assertFalse(perms.contains(PosixFilePermission.GROUP_READ));
        assertFalse(perms.contains(PosixFilePermission.OTHERS_READ));
        assertFalse(perms.contains(PosixFilePermission.GROUP_WRITE));
        assertFalse(perms.contains(PosixFilePermission.OTHERS_WRITE));
    }

    @Test
    void operations_after_close_fail_with_storage_unavailable() {
        var s = openStore();
        s.close();

        assertThrows(StorageUnavailableException.class, () -> s.get("x"));
        assertThrows(StorageUnavailableException.class, () -> s.put("x", b("1")));
        assertThrows(StorageUnavailableException.class, () -> s.forEach((k, v) -> { }));
    }

    @Test
    void ensure_namespace_is_idempotent() {
        var s = openStore();
        s.put("a", b("1"));

        s.ensureNamespace();
        s.ensureNamespace();

        assertArrayEquals(b("1"), s.get("a").orElseThrow());
    }

    @Test
    void map_full_surfaces_as_storage_unavailable_and_store_stays_usable() {
        store = LmdbKeyValueStore.open(dir.resolve("tiny.db"),
                StoreOptions.defaults().withMapSizeBytes(256 * 1024));
        store.put("small", b("ok"));

        byte[] huge = new byte[1024 * 1024];
        assertThrows(StorageUnavailableException.class, () -> store.put("huge", huge));

        assertTrue(store.get("huge").isEmpty());
        assertArrayEquals(b("ok"), store.get("small").orElseThrow());
        store.put("after", b("still writable"));
        assertTrue(store.get("after").isPresent());
    }
}
