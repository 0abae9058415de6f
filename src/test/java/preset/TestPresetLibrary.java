package preset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestPresetLibrary {

    private static final String CUSTOM = "{ \"faded\": { \"description\": \"washed out\","
            + " \"variables\": { \"lift\": 0.2 },"
            + " \"operations\": [ { \"kind\": \"levels\", \"parameters\": { \"black\": 0, \"white\": 0.9 } },"
            + " { \"kind\": \"saturation\", \"parameters\": { \"factor\": 0.7 } } ] },"
            + " \"vintage\": { \"operations\": [ { \"kind\": \"sepia\" } ] } }";

    @Test
    public void test_builtInPresets() throws Exception {
        PresetLibrary lib = PresetLibrary.builtIn();
        for (String name : new String[] { "vintage", "noir", "pop", "cinematic", "sketch", "thumbnail" })
            assertTrue(lib.get(name).isPresent(), name);
        // every built-in with defaults for all slots must instantiate cleanly
        for (Preset p : lib.all()) {
            if (!p.variables().containsValue(null))
                assertFalse(p.instantiate().isEmpty(), p.name());
        }
    }

    @Test
    public void test_read() throws Exception {
        PresetLibrary lib = PresetLibrary.read(new StringReader(CUSTOM));
        assertEquals(2, lib.size());
        Preset faded = lib.get("faded").orElseThrow();
        assertEquals("washed out", faded.description());
        assertEquals(2, faded.steps().size());
        assertEquals("levels", faded.steps().get(0).kind());
        assertTrue(lib.get("vintage").orElseThrow().steps().get(0).parameters().isEmpty());
        assertTrue(lib.get("missing").isEmpty());
    }

    @Test
    public void test_readRejectsBadShape() {
        assertThrows(IOException.class, () -> PresetLibrary.read(new StringReader("{ not json")));
        assertThrows(IOException.class, () -> PresetLibrary.read(new StringReader("{ \"x\": { \"description\": \"d\" } }")));
        assertThrows(IOException.class,
                () -> PresetLibrary.read(new StringReader("{ \"x\": { \"operations\": [ { \"parameters\": {} } ] } }")));
    }

    @Test
    public void test_loadAndMerge(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("mine.json");
        Files.writeString(file, CUSTOM, StandardCharsets.UTF_8);
        PresetLibrary merged = PresetLibrary.builtIn().merge(PresetLibrary.load(file));
        assertTrue(merged.get("faded").isPresent());
        assertTrue(merged.get("noir").isPresent());
        // the loaded file overrides the built-in of the same name
        assertEquals(1, merged.get("vintage").orElseThrow().steps().size());
        assertThrows(IOException.class, () -> PresetLibrary.load(dir.resolve("absent.json")));
    }
}
