import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.oxlang.script.EngineConfig;

public class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig c = EngineConfig.defaults();
        assertEquals(256, c.maxRecursionDepth());
        assertFalse(c.preloadStdlib());
        assertFalse(c.traceCalls());
        assertEquals("ox/", c.modulePrefix());
    }

    @Test
    void fromJson_readsKnownKeysAndIgnoresOthers() throws Exception {
        EngineConfig c = EngineConfig.fromJson(
                "{\"maxRecursionDepth\": 12, \"traceCalls\": true, \"extra\": [1, 2]}");
        assertEquals(12, c.maxRecursionDepth());
        assertTrue(c.traceCalls());
        assertFalse(c.preloadStdlib());
        assertEquals("ox/", c.modulePrefix());
    }

    @Test
    void fromJson_stream() throws Exception {
        byte[] json = "{\"preloadStdlib\": true, \"modulePrefix\": \"lib/\"}".getBytes(StandardCharsets.UTF_8);
        EngineConfig c = EngineConfig.fromJson(new ByteArrayInputStream(json));
        assertTrue(c.preloadStdlib());
        assertEquals("lib/", c.modulePrefix());
    }

    @Test
    void fromJson_rejectsBadValues() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"maxRecursionDepth\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"maxRecursionDepth\": 1.5}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{\"preloadStdlib\": \"yes\"}"));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("[1]"));
    }

    @Test
    void load_readsClasspathResource() {
        EngineConfig c = EngineConfig.load();
        assertEquals(256, c.maxRecursionDepth());
        assertEquals("ox/", c.modulePrefix());
    }

    @Test
    void toJson_matchesSettings() {
        EngineConfig c = EngineConfig.builder().maxRecursionDepth(99).traceCalls(true).build();
        assertEquals(99, c.toJson().get("maxRecursionDepth").asInt());
        assertTrue(c.toJson().get("traceCalls").asBoolean());
    }
}
