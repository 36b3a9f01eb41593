package io.regstore.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StoreConfigTest {

    @TempDir Path dir;

    @Test
    void defaults() {
        StoreConfig c = StoreConfig.defaults();
        assertEquals(Path.of("./regstore.db"), c.path());
        assertEquals(Duration.ofSeconds(5), c.lockTimeout());
        assertTrue(c.syncWrites());
    }

    @Test
    void options_override_defaults() {
        StoreConfig c = StoreConfig.fromOptions(Map.of("path", "/tmp/x.db", "lockTimeoutMillis", 250, "syncWrites", false));
        assertEquals(Path.of("/tmp/x.db"), c.path());
        assertEquals(Duration.ofMillis(250), c.lockTimeout());
        assertFalse(c.syncWrites());

        assertEquals(StoreConfig.defaults(), StoreConfig.fromOptions(Map.of()));
    }

    @Test
    void bad_options_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromOptions(Map.of("path", 3)));
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromOptions(Map.of("lockTimeoutMillis", "soon")));
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromOptions(Map.of("syncWrites", "yes")));
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromOptions(Map.of("lockTimeoutMillis", 0)));
    }

    @Test
    void loads_json_file() throws Exception {
        Path file = dir.resolve("store.json");
        Files.writeString(file, "{\"path\": \"data/registry\", \"lockTimeoutMillis\": 1500}");
        StoreConfig c = StoreConfig.fromJsonFile(file);
        assertEquals(Path.of("data/registry"), c.path());
        assertEquals(Duration.ofMillis(1500), c.lockTimeout());
        assertTrue(c.syncWrites());
    }

    @Test
    void unreadable_json_file_is_an_argument_error() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromJsonFile(dir.resolve("missing.json")));
        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.fromJsonFile(broken));
    }
}
