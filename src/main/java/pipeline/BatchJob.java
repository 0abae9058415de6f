package pipeline;

import image.PixelBuffer;

/** One unit of batch work; {@code id} is echoed in the result (usually the input file name). */
public record BatchJob(String id, PixelBuffer input, Pipeline pipeline) {

    public BatchJob {
        if (id == null || input == null || pipeline == null)
            throw new IllegalArgumentException("batch job needs an id, an input and a pipeline");
    }
}
