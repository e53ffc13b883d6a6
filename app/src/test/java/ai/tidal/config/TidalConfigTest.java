package ai.tidal.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TidalConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        var config = TidalConfig.defaults();
        assertEquals(Duration.ofMillis(50), config.dedupWindow());
        assertEquals(50, config.dedupCapacity());
        assertEquals(Duration.ofMillis(50), config.coalesceInterval());
        assertEquals(50, config.duplicatePrefixLength());
        assertTrue(config.normalizeContent());
        assertFalse(config.strictInvariants());
        assertTrue(config.workerThreads() >= 2);
    }

    @Test
    void propertiesOverlayRecognizedKeys() {
        var props = new Properties();
        props.setProperty(TidalConfig.DEDUP_WINDOW_MS, "120");
        props.setProperty(TidalConfig.STRICT_INVARIANTS, "TRUE");
        props.setProperty("unrelated.key", "ignored");

        var config = TidalConfig.defaults().overlay(props);
        assertEquals(Duration.ofMillis(120), config.dedupWindow());
        assertTrue(config.strictInvariants());
    }

    @Test
    void environmentOverlayUsesUpperSnakeNames() {
        assertEquals("TIDAL_COALESCE_INTERVAL_MS", TidalConfig.envName(TidalConfig.COALESCE_INTERVAL_MS));
        var config = TidalConfig.defaults()
                .overlayEnvironment(Map.of("TIDAL_COALESCE_INTERVAL_MS", "5", "TIDAL_WORKER_THREADS", "7"));
        assertEquals(Duration.ofMillis(5), config.coalesceInterval());
        assertEquals(7, config.workerThreads());
    }

    @Test
    void fileIsAppliedOverClasspathDefaults(@TempDir Path dir) throws Exception {
        var file = dir.resolve("tidal.properties");
        Files.writeString(file, TidalConfig.DUPLICATE_PREFIX_LENGTH + "=12\n" + TidalConfig.NORMALIZE_CONTENT + "=false\n");

        var config = TidalConfig.load(file).overlayEnvironment(Map.of());
        assertEquals(12, config.duplicatePrefixLength());
        assertFalse(config.normalizeContent());
    }

    @Test
    void invalidValuesFailFast(@TempDir Path dir) {
        var defaults = TidalConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.with(TidalConfig.DEDUP_CAPACITY, "lots"));
        assertThrows(IllegalArgumentException.class, () -> defaults.with(TidalConfig.STRICT_INVARIANTS, "yes"));
        assertThrows(IllegalArgumentException.class, () -> defaults.with(TidalConfig.DEDUP_WINDOW_MS, "-1"));
        assertThrows(IllegalArgumentException.class, () -> defaults.with("tidal.unknown", "1"));
        assertThrows(IllegalArgumentException.class, () -> TidalConfig.load(dir.resolve("missing.properties")));
    }
}
