package org.pipesteps.datapipeline.api.exceptions;

/**
 * Thrown when results are requested before any batch has been committed.
 */
public class IncompleteFrontierException extends PipelineException {

    public IncompleteFrontierException(String message) {
        super(message);
    }
}
