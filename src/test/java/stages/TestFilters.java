package stages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import image.PixelBuffer;
import ops.OperationKind;
import ops.OperationRegistry;
import ops.ParameterSet;

public class TestFilters {

    private static final Set<OperationKind> POINTWISE = EnumSet.of(OperationKind.BRIGHTNESS,
            OperationKind.CONTRAST, OperationKind.EXPOSURE, OperationKind.LEVELS, OperationKind.NEGATIVE,
            OperationKind.POSTERIZE, OperationKind.SOLARIZE);

    private static ParameterSet params(OperationKind kind) throws Exception {
        Map<String, ?> raw = switch (kind) {
            case CROP -> Map.of("x", 1, "y", 1, "w", 4, "h", 3);
            case RESIZE -> Map.of("w", 5, "h", 7);
            case BRIGHTNESS -> Map.of("amount", 30);
            case CONTRAST -> Map.of("amount", -40);
            case EXPOSURE -> Map.of("stops", 0.7);
            case LEVELS -> Map.of("black", 0.1, "white", 0.8, "gamma", 1.4);
            default -> Map.of();
        };
        return OperationRegistry.standard().validate(kind, raw);
    }

    @Test
    public void test_everyKindRunsAndKeepsAlpha() throws Exception {
        PixelBuffer src = TestArtisticFilters.noise(8, 6, 3, 12);
        int[] s = new int[8 * 6 * 4];
        for (int p = 0; p < 48; p++) {
            s[p * 4] = src.sample(p * 3);
            s[p * 4 + 1] = src.sample(p * 3 + 1);
            s[p * 4 + 2] = src.sample(p * 3 + 2);
            s[p * 4 + 3] = 200;
        }
        PixelBuffer rgba = new PixelBuffer(8, 6, 4, 8, s);
        int[] before = rgba.samples();

        for (OperationKind kind : OperationKind.values()) {
            PixelBuffer out = Filters.forKind(kind).apply(rgba, params(kind));
            assertNotNull(out, kind.id());
            assertNotSame(rgba, out, kind.id());
            if (kind == OperationKind.FLATTEN) {
                assertEquals(3, out.channels());
                continue;
            }
            assertEquals(4, out.channels(), kind.id());
            for (int i = 3; i < out.sampleCount(); i += 4)
                assertEquals(200, out.sample(i), kind.id());
        }
        // input untouched by all of the above
        assertEquals(new PixelBuffer(8, 6, 4, 8, before), rgba);
    }

    @Test
    public void test_lutMatchesFilter() throws Exception {
        PixelBuffer src = TestArtisticFilters.noise(9, 9, 4, 31);
        for (OperationKind kind : OperationKind.values()) {
            ParameterSet p = params(kind);
            Lut lut = Filters.lut(kind, p, 255);
            if (!POINTWISE.contains(kind)) {
                assertNull(lut, kind.id());
                continue;
            }
            assertNotNull(lut, kind.id());
            assertEquals(Filters.forKind(kind).apply(src, p), lut.apply(src), kind.id());
        }
    }
}
