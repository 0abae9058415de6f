package ops;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class TestOperationRegistry {

    private final OperationRegistry registry = OperationRegistry.standard();

    @Test
    public void test_everyKindHasSchema() throws Exception {
        for (OperationKind kind : OperationKind.values()) {
            assertNotNull(registry.schema(kind), kind.id());
            if (kind == OperationKind.CROP || kind == OperationKind.RESIZE)
                assertThrows(ValidationException.class, () -> registry.validate(kind, Map.of()));
            else
                registry.validate(kind, Map.of());
        }
    }

    @Test
    public void test_kindLookup() throws Exception {
        assertEquals(OperationKind.OIL_PAINTING, OperationRegistry.kindOf("oil-painting"));
        assertEquals(OperationKind.OIL_PAINTING, OperationRegistry.kindOf("OIL_PAINTING"));
        ValidationException e = assertThrows(ValidationException.class, () -> OperationRegistry.kindOf("melt"));
        assertEquals("kind", e.getParameter());
    }

    @Test
    public void test_defaultsFilled() throws Exception {
        ParameterSet p = registry.validate("rotate", Map.of("angle", 45));
        assertEquals(45.0, p.getDouble("angle"));
        assertEquals("bilinear", p.getString("interpolation"));
        assertEquals(new Rgba(0, 0, 0, 255), p.getColor("fill"));
        assertTrue(p.getBoolean("expand"));
        assertEquals(List.of("angle", "interpolation", "fill", "expand"), List.copyOf(p.asMap().keySet()));
    }

    @Test
    public void test_optionalAbsent() throws Exception {
        ParameterSet p = registry.validate(OperationKind.PIXELATE, Map.of());
        assertFalse(p.has("region"));
        assertNull(p.getRect("region"));
        assertFalse(registry.validate(OperationKind.EDGE_DETECTION, Map.of()).has("threshold"));
    }

    @Test
    public void test_stringValuesParsed() throws Exception {
        ParameterSet p = registry.validate("pixelate", Map.of("size", "4", "region", "0, 0, 8,6"));
        assertEquals(4, p.getInt("size"));
        assertEquals(new Rect(0, 0, 8, 6), p.getRect("region"));

        p = registry.validate("swirl", Map.of("center", List.of(3.0, 4.0), "degrees", "180"));
        assertEquals(new Point(3, 4), p.getPoint("center"));
        assertEquals(180.0, p.getDouble("degrees"));

        p = registry.validate("flip", Map.of("direction", "HORIZONTAL"));
        assertEquals("horizontal", p.getString("direction"));
    }

    @Test
    public void test_integralDoubleAccepted() throws Exception {
        assertEquals(20, registry.validate("brightness", Map.of("amount", 20.0)).getInt("amount"));
        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.validate("brightness", Map.of("amount", 20.5)));
        assertEquals("amount", e.getParameter());
    }

    @Test
    public void test_outOfRange() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.validate("brightness", Map.of("amount", 300)));
        assertEquals("brightness", e.getKind());
        assertEquals("amount", e.getParameter());
        assertTrue(e.getMessage().contains("amount"));
    }

    @Test
    public void test_unknownParameter() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.validate("sepia", Map.of("intensity", 0.5, "tint", 1)));
        assertEquals("tint", e.getParameter());
    }

    @Test
    public void test_wrongTypes() {
        assertEquals("direction", assertThrows(ValidationException.class,
                () -> registry.validate("flip", Map.of("direction", "diagonal"))).getParameter());
        assertEquals("fill", assertThrows(ValidationException.class,
                () -> registry.validate("rotate", Map.of("fill", "#12"))).getParameter());
        assertEquals("expand", assertThrows(ValidationException.class,
                () -> registry.validate("rotate", Map.of("expand", "maybe"))).getParameter());
        assertEquals("region", assertThrows(ValidationException.class,
                () -> registry.validate("pixelate", Map.of("region", "0,0,4"))).getParameter());
    }

    @Test
    public void test_resizeZeroWidthNamesW() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.validate("resize", Map.of("w", 0, "h", 10)));
        assertEquals("w", e.getParameter());
        assertEquals("resize", e.getKind());
    }

    @Test
    public void test_resizeTarget() throws Exception {
        assertEquals("w", assertThrows(ValidationException.class,
                () -> registry.validate("resize", Map.of("h", 10))).getParameter());
        assertEquals("h", assertThrows(ValidationException.class,
                () -> registry.validate("resize", Map.of("w", 10))).getParameter());
        assertEquals("scale", assertThrows(ValidationException.class,
                () -> registry.validate("resize", Map.of("w", 10, "h", 10, "scale", 2))).getParameter());
        assertEquals(0.5, registry.validate("resize", Map.of("scale", 0.5)).getDouble("scale"));
    }

    @Test
    public void test_cropRequiresAll() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.validate("crop", Map.of("x", 0, "y", 0, "w", 4)));
        assertEquals("h", e.getParameter());
        assertEquals("crop", e.getKind());
    }

    @Test
    public void test_levelsBlackBelowWhite() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.validate("levels", Map.of("black", 0.6, "white", 0.4)));
        assertEquals("white", e.getParameter());
        assertEquals("levels", e.getKind());
    }

    @Test
    public void test_validateIsIdempotent() throws Exception {
        List<Map<String, ?>> inputs = List.of(
                Map.of("angle", "30", "fill", "red", "expand", "false"),
                Map.of("size", 6, "region", "1,1,4,4"),
                Map.of("degrees", 45, "center", List.of(1, 2)),
                Map.of("shadows-red", 0.2, "highlights-blue", "-0.1"));
        OperationKind[] kinds = { OperationKind.ROTATE, OperationKind.PIXELATE, OperationKind.SWIRL,
                OperationKind.COLOR_BALANCE };
        for (int i = 0; i < kinds.length; i++) {
            ParameterSet once = registry.validate(kinds[i], inputs.get(i));
            ParameterSet twice = registry.validate(kinds[i], once.asMap());
            assertEquals(once, twice, kinds[i].id());
        }
    }

    @Test
    public void test_parameterSetUnmodifiable() throws Exception {
        ParameterSet p = registry.validate("sepia", Map.of());
        assertThrows(UnsupportedOperationException.class, () -> p.asMap().put("intensity", 0.1));
    }
}
