package preset;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Named presets read from JSON:
 *
 * <pre>
 * { "vintage": { "description": "...",
 *                "variables": { "warmth": 5200 },
 *                "operations": [ { "kind": "color-temperature", "parameters": { "kelvin": "$warmth" } } ] } }
 * </pre>
 *
 * Loading only checks the shape; steps are validated when a preset is
 * instantiated.
 */
public final class PresetLibrary {

    private static final Logger logger = LoggerFactory.getLogger(PresetLibrary.class);

    /** Bundled presets on the classpath. */
    public static final String BUILT_IN_RESOURCE = "/presets/default-presets.json";

    private static final Type FILE_TYPE = new TypeToken<LinkedHashMap<String, PresetJson>>() {
    }.getType();

    private final Map<String, Preset> presets;

    private PresetLibrary(Map<String, Preset> presets) {
        this.presets = Collections.unmodifiableMap(presets);
    }

    public static PresetLibrary of(Collection<Preset> presets) {
        Map<String, Preset> map = new LinkedHashMap<>();
        for (Preset p : presets)
            map.put(p.name(), p);
        return new PresetLibrary(map);
    }

    public static PresetLibrary builtIn() throws IOException {
        try (InputStream in = PresetLibrary.class.getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (in == null)
                throw new IOException("Missing resource " + BUILT_IN_RESOURCE);
            return read(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    public static PresetLibrary load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            PresetLibrary lib = read(reader);
            logger.info("Loaded {} presets from {}", lib.size(), file);
            return lib;
        }
    }

    /**
     * @throws IOException if the JSON is malformed or an entry lacks operations
     */
    public static PresetLibrary read(Reader reader) throws IOException {
        Map<String, PresetJson> raw;
        try {
            raw = new Gson().fromJson(reader, FILE_TYPE);
        } catch (JsonParseException e) {
            throw new IOException("Invalid preset JSON: " + e.getMessage(), e);
        }
        Map<String, Preset> map = new LinkedHashMap<>();
        if (raw == null)
            return new PresetLibrary(map);
        for (Map.Entry<String, PresetJson> e : raw.entrySet()) {
            PresetJson pj = e.getValue();
            if (pj == null || pj.operations == null)
                throw new IOException("Preset '" + e.getKey() + "' has no operations");
            List<PresetStep> steps = new ArrayList<>();
            for (StepJson s : pj.operations) {
                if (s == null || s.kind == null)
                    throw new IOException("Preset '" + e.getKey() + "' has a step without a kind");
                steps.add(new PresetStep(s.kind, s.parameters));
            }
            map.put(e.getKey(), new Preset(e.getKey(), pj.description, steps, pj.variables));
        }
        return new PresetLibrary(map);
    }

    public Optional<Preset> get(String name) {
        return Optional.ofNullable(presets.get(name));
    }

    public Collection<Preset> all() {
        return presets.values();
    }

    public int size() {
        return presets.size();
    }

    /** This library's presets overlaid with {@code other}'s (same name: other wins). */
    public PresetLibrary merge(PresetLibrary other) {
        Map<String, Preset> map = new LinkedHashMap<>(presets);
        map.putAll(other.presets);
        return new PresetLibrary(map);
    }

    // ---------------- JSON shape ----------------

    private static class PresetJson {
        String description;
        Map<String, Object> variables;
        List<StepJson> operations;
    }

    private static class StepJson {
        String kind;
        Map<String, Object> parameters;
    }
}
