package preset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One preset entry before validation. Parameter values are raw (as read
 * from JSON) and may be {@code "$name"} variable references.
 */
public record PresetStep(String kind, Map<String, Object> parameters) {

    public PresetStep {
        if (kind == null)
            throw new IllegalArgumentException("preset step needs a kind");
        parameters = parameters == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
