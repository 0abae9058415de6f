package pipeline;

import ops.OperationKind;

/**
 * A stage failed at run time. Carries the zero-based stage index and kind;
 * the cause is the filter's own failure.
 */
public class PipelineExecutionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int stageIndex;
    private final OperationKind kind;

    public PipelineExecutionException(int stageIndex, OperationKind kind, Throwable cause) {
        super("stage " + stageIndex + " (" + kind.id() + ") failed: " + cause.getMessage(), cause);
        this.stageIndex = stageIndex;
        this.kind = kind;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public OperationKind getKind() {
        return kind;
    }
}
