package org.pipesteps.datapipeline.api.exceptions;

/**
 * Base class of all errors raised by the batch pipeline.
 * <p>
 * This is a RuntimeException because pipeline failures indicate configuration, data or step
 * defects that the pipeline never recovers from automatically. Retrying is the caller's
 * decision, exercised by running the pipeline again with resume enabled after fixing the cause.
 * Storage I/O failures are reported separately as checked {@link java.io.IOException}s.
 */
public class PipelineException extends RuntimeException {

    /**
     * Creates a PipelineException with the specified message.
     *
     * @param message Description of the failure
     */
    public PipelineException(String message) {
        super(message);
    }

    /**
     * Creates a PipelineException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
