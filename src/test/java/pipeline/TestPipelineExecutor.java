package pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;

import image.PixelBuffer;
import image.PreconditionViolationException;
import ops.OperationKind;
import ops.ValidationException;
import stages.FilterException;

public class TestPipelineExecutor {

    private final PipelineExecutor executor = new PipelineExecutor();

    static PixelBuffer random(int w, int h, int channels, long seed) {
        Random rnd = new Random(seed);
        int[] s = new int[w * h * channels];
        for (int i = 0; i < s.length; i++)
            s[i] = rnd.nextInt(256);
        return new PixelBuffer(w, h, channels, 8, s);
    }

    @Test
    public void test_emptyPipelineIsIdentity() throws Exception {
        PixelBuffer src = random(5, 3, 4, 1);
        PixelBuffer out = executor.execute(src, Pipeline.empty());
        assertEquals(src, out);
        assertTrue(Pipeline.of().isEmpty());
    }

    @Test
    public void test_brightnessScenario() throws Exception {
        PixelBuffer gray = PixelBuffer.filled(4, 4, 8, 128, 128, 128);
        Pipeline p = Pipeline.of(Operation.of("brightness", Map.of("amount", 20)));
        assertEquals(PixelBuffer.filled(4, 4, 8, 148, 148, 148), executor.execute(gray, p));
    }

    @Test
    public void test_cropThenNearestResize() throws Exception {
        PixelBuffer src = random(4, 4, 3, 2);
        Pipeline p = Pipeline.builder()
                .add("crop", Map.of("x", 1, "y", 1, "w", 2, "h", 2))
                .add("resize", Map.of("w", 4, "h", 4, "method", "nearest"))
                .build();
        PixelBuffer out = executor.execute(src, p);
        assertEquals(4, out.width());
        assertEquals(4, out.height());
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                for (int c = 0; c < 3; c++)
                    assertEquals(src.sample(1 + x / 2, 1 + y / 2, c), out.sample(x, y, c));
            }
        }
    }

    @Test
    public void test_rotateZeroIsIdentity() throws Exception {
        PixelBuffer src = random(6, 4, 3, 3);
        assertEquals(src, executor.execute(src, Pipeline.of(Operation.of("rotate", Map.of("angle", 0)))));
    }

    @Test
    public void test_negativeTwiceIsIdentity() throws Exception {
        PixelBuffer src = random(6, 4, 4, 4);
        Operation neg = Operation.of(OperationKind.NEGATIVE);
        assertEquals(src, executor.execute(src, Pipeline.of(neg, neg)));
    }

    @Test
    public void test_invalidOperationNeverBuilt() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> Operation.of("resize", Map.of("w", 0, "h", 10)));
        assertEquals("w", e.getParameter());
    }

    @Test
    public void test_failingStageReported() throws Exception {
        PixelBuffer src = random(8, 8, 3, 5);
        Pipeline p = Pipeline.builder()
                .add("brightness", Map.of("amount", 10))
                .add("resize", Map.of("w", 4, "h", 4))
                .add("crop", Map.of("x", 2, "y", 2, "w", 4, "h", 4))
                .build();
        PipelineExecutionException e = assertThrows(PipelineExecutionException.class, () -> executor.execute(src, p));
        assertEquals(2, e.getStageIndex());
        assertEquals(OperationKind.CROP, e.getKind());
        assertInstanceOf(FilterException.class, e.getCause());
    }

    @Test
    public void test_oversizedResizeIsStageFailure() throws Exception {
        PixelBuffer tiny = PixelBuffer.filled(1, 1, 8, 9, 9, 9);
        Pipeline p = Pipeline.of(Operation.of("resize", Map.of("w", 40000, "h", 40000, "method", "nearest")));
        PipelineExecutionException e = assertThrows(PipelineExecutionException.class, () -> executor.execute(tiny, p));
        assertEquals(0, e.getStageIndex());
        assertEquals(OperationKind.RESIZE, e.getKind());
        assertInstanceOf(FilterException.class, e.getCause());
    }

    @Test
    public void test_malformedBufferIsPrecondition() throws Exception {
        Pipeline p = Pipeline.of(Operation.of("brightness", Map.of("amount", 1)));
        assertThrows(PreconditionViolationException.class,
                () -> executor.execute(PixelBuffer.wrap(1, 1, 3, 8, new int[] { 300, 0, 0 }), p));
    }

    @Test
    public void test_inputNotModified() throws Exception {
        PixelBuffer src = random(10, 10, 3, 6);
        PixelBuffer copy = new PixelBuffer(10, 10, 3, 8, src.samples());
        executor.execute(src, Pipeline.builder()
                .add("blur", Map.of())
                .add("oil-painting", Map.of("radius", 1))
                .add("flip", Map.of("direction", "horizontal"))
                .build());
        assertEquals(copy, src);
    }

    @Test
    public void test_gpuExecutorMatchesCpu() throws Exception {
        PixelBuffer src = random(16, 16, 4, 7);
        Pipeline p = Pipeline.builder()
                .add("levels", Map.of("black", 0.1, "gamma", 1.3))
                .add("posterize", Map.of("levels", 5))
                .add("sepia", Map.of())
                .build();
        PipelineExecutor gpu = new PipelineExecutor(true);
        assertTrue(gpu.usesGpu());
        assertEquals(executor.execute(src, p), gpu.execute(src, p));
    }

    @Test
    public void test_pipelineIsImmutable() throws Exception {
        Operation op = Operation.of(OperationKind.GRAYSCALE);
        Pipeline one = Pipeline.of(op);
        Pipeline two = one.then(op);
        assertEquals(1, one.size());
        assertEquals(2, two.size());
        assertThrows(UnsupportedOperationException.class, () -> two.operations().add(op));
        assertSame(Pipeline.empty(), Pipeline.builder().build());
    }
}
