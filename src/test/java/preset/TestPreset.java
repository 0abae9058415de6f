package preset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ops.OperationKind;
import ops.ValidationException;
import pipeline.Pipeline;

public class TestPreset {

    private static Preset warm() {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("amount", 25);
        vars.put("size", null);
        return new Preset("warm", "test", List.of(
                new PresetStep("brightness", Map.of("amount", "$amount")),
                new PresetStep("pixelate", Map.of("size", "$size"))), vars);
    }

    @Test
    public void test_substitution() throws Exception {
        Pipeline p = warm().instantiate(Map.of("size", 4));
        assertEquals(2, p.size());
        assertEquals(OperationKind.BRIGHTNESS, p.operations().get(0).kind());
        assertEquals(25, p.operations().get(0).params().getInt("amount"));
        assertEquals(4, p.operations().get(1).params().getInt("size"));

        p = warm().instantiate(Map.of("size", "8", "amount", -5));
        assertEquals(-5, p.operations().get(0).params().getInt("amount"));
        assertEquals(8, p.operations().get(1).params().getInt("size"));
    }

    @Test
    public void test_nullValuesUseDefaults() throws Exception {
        Preset noir = PresetLibrary.builtIn().get("noir").orElseThrow();
        assertEquals(noir.instantiate(), noir.instantiate(null));
        ValidationException e = assertThrows(ValidationException.class, () -> warm().instantiate(null));
        assertEquals("size", e.getParameter());
    }

    @Test
    public void test_requiredVariable() {
        ValidationException e = assertThrows(ValidationException.class, () -> warm().instantiate());
        assertEquals("size", e.getParameter());
        assertNull(e.getKind());
    }

    @Test
    public void test_unknownVariable() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> warm().instantiate(Map.of("size", 4, "radius", 3)));
        assertEquals("radius", e.getParameter());
    }

    @Test
    public void test_undeclaredReference() {
        Preset p = new Preset("broken", null, List.of(new PresetStep("blur", Map.of("radius", "$r"))), Map.of());
        ValidationException e = assertThrows(ValidationException.class, p::instantiate);
        assertEquals("blur", e.getKind());
        assertEquals("radius", e.getParameter());
    }

    @Test
    public void test_invalidSubstitutedValue() {
        ValidationException e = assertThrows(ValidationException.class, () -> warm().instantiate(Map.of("size", 0)));
        assertEquals("pixelate", e.getKind());
        assertEquals("size", e.getParameter());
    }

    @Test
    public void test_builtInThumbnail() throws Exception {
        Preset thumb = PresetLibrary.builtIn().get("thumbnail").orElseThrow();
        ValidationException e = assertThrows(ValidationException.class, thumb::instantiate);
        assertEquals("scale", e.getParameter());
        Pipeline p = thumb.instantiate(Map.of("scale", 0.5));
        assertEquals(OperationKind.FLATTEN, p.operations().get(0).kind());
        assertEquals(OperationKind.RESIZE, p.operations().get(1).kind());
    }
}
