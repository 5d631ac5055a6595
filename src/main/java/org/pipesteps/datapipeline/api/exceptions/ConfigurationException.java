package org.pipesteps.datapipeline.api.exceptions;

/**
 * Thrown when a pipeline is composed incorrectly: no steps, duplicate or unusable step names,
 * an invalid batch size, or a step definition that cannot be instantiated.
 * <p>
 * Always raised while the pipeline is being constructed, before any fetch or storage access.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
