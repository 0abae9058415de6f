package pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import image.PixelBuffer;
import stages.FilterException;
import stages.GpuProcessor;
import stages.Lut;
import util.Timing;

/**
 * Runs a {@link Pipeline} over one buffer, stage by stage. Stateless apart
 * from the GPU switch, so one executor can be shared between threads.
 */
public final class PipelineExecutor {

    private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);

    private final boolean useGpu;

    public PipelineExecutor() {
        this(false);
    }

    /**
     * @param useGpu run 8-bit pointwise stages through the OpenCL LUT kernel
     */
    public PipelineExecutor(boolean useGpu) {
        this.useGpu = useGpu;
    }

    public boolean usesGpu() {
        return useGpu;
    }

    /**
     * Apply every stage in order. The first failing stage aborts the run and
     * nothing of the partial result is returned.
     *
     * @throws PipelineExecutionException naming the failing stage
     * @throws image.PreconditionViolationException if a stage is handed or
     *         produces a malformed buffer; not wrapped
     */
    public PixelBuffer execute(PixelBuffer input, Pipeline pipeline) throws PipelineExecutionException {
        if (pipeline.isEmpty())
            return input;
        Timing timing = new Timing(logger);
        PixelBuffer current = input;
        int index = 0;
        for (Operation op : pipeline.operations()) {
            try {
                current = applyStage(op, current);
            } catch (FilterException e) {
                logger.debug("Stage {} ({}) failed on {}", index, op.kind().id(), current, e);
                throw new PipelineExecutionException(index, op.kind(), e);
            }
            timing.stop("stage " + index + " " + op.kind().id());
            index++;
        }
        logger.debug("Pipeline of {} stages done in {} ms", pipeline.size(), String.format("%.2f", timing.total()));
        return current;
    }

    private PixelBuffer applyStage(Operation op, PixelBuffer src) throws FilterException {
        if (useGpu && src.bitDepth() == 8) {
            Lut lut = op.lut(src.maxValue());
            if (lut != null)
                return GpuProcessor.applyLut(src, lut);
        }
        return op.apply(src);
    }
}
