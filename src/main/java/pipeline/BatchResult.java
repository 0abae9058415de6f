package pipeline;

import image.PixelBuffer;

/**
 * Outcome of one {@link BatchJob}. {@code output} is set only for
 * {@link Status#SUCCEEDED}, {@code error} only for {@link Status#FAILED}.
 */
public record BatchResult(String id, Status status, PixelBuffer output, PipelineExecutionException error,
        double millis) {

    public enum Status {
        SUCCEEDED, FAILED, CANCELLED
    }

    static BatchResult succeeded(String id, PixelBuffer output, double millis) {
        return new BatchResult(id, Status.SUCCEEDED, output, null, millis);
    }

    static BatchResult failed(String id, PipelineExecutionException error, double millis) {
        return new BatchResult(id, Status.FAILED, null, error, millis);
    }

    static BatchResult cancelled(String id) {
        return new BatchResult(id, Status.CANCELLED, null, null, 0);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
