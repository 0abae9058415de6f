package app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ops.OperationKind;
import ops.Rect;
import ops.ValidationException;
import pipeline.Operation;

public class TestOpSpecParser {

    @Test
    public void test_bareKind() throws Exception {
        Operation op = OpSpecParser.parse(" grayscale ");
        assertEquals(OperationKind.GRAYSCALE, op.kind());
    }

    @Test
    public void test_parameters() throws Exception {
        Operation op = OpSpecParser.parse("crop:x=1; y=2;w=30;h=40;");
        assertEquals(OperationKind.CROP, op.kind());
        assertEquals(30, op.params().getInt("w"));

        op = OpSpecParser.parse("pixelate:size=4;region=0,0,32,16");
        assertEquals(new Rect(0, 0, 32, 16), op.params().getRect("region"));
    }

    @Test
    public void test_malformed() {
        ValidationException e = assertThrows(ValidationException.class, () -> OpSpecParser.parse("blur:radius"));
        assertEquals("radius", e.getParameter());
        e = assertThrows(ValidationException.class, () -> OpSpecParser.parse("blur:radius=2;radius=3"));
        assertEquals("radius", e.getParameter());
        e = assertThrows(ValidationException.class, () -> OpSpecParser.parse("blur:radius=99"));
        assertEquals("blur", e.getKind());
    }

    @Test
    public void test_variables() throws Exception {
        assertEquals(Map.of("warmth", "4500", "seed", "3"), OpSpecParser.parseVariables(List.of("warmth=4500", "seed = 3")));
        assertThrows(ValidationException.class, () -> OpSpecParser.parseVariables(List.of("=3")));
    }
}
