package org.pipesteps.datapipeline.api.exceptions;

/**
 * Thrown when a step fails to process a batch, or returns an output that does not describe the
 * same batch position as its input.
 * <p>
 * There is no partial success for a batch: the frontier stays at the previous batch and a resumed
 * run recomputes batch {@link #getBatchId()} through every step, starting with the first.
 */
public class StepException extends PipelineException {

    private final long batchId;
    private final String stepName;

    public StepException(long batchId, String stepName, String message) {
        super(formatMessage(batchId, stepName, message));
        this.batchId = batchId;
        this.stepName = stepName;
    }

    public StepException(long batchId, String stepName, String message, Throwable cause) {
        super(formatMessage(batchId, stepName, message), cause);
        this.batchId = batchId;
        this.stepName = stepName;
    }

    /**
     * @return id of the batch being processed when the step failed
     */
    public long getBatchId() {
        return batchId;
    }

    /**
     * @return name of the failing step
     */
    public String getStepName() {
        return stepName;
    }

    private static String formatMessage(long batchId, String stepName, String message) {
        return "Step '" + stepName + "' failed on batch " + batchId + ": " + message;
    }
}
