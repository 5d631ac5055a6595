package org.pipesteps.datapipeline.api.exceptions;

import java.nio.file.Path;

/**
 * Thrown when a persisted frontier exists but cannot be parsed or fails its schema checks.
 * <p>
 * Always fatal. The frontier is never repaired automatically because guessing the progress of a
 * damaged record risks duplicating or dropping data; an operator must reset the pipeline or fix
 * the file by hand.
 */
public class FrontierCorruptionException extends PipelineException {

    private final transient Path path;

    public FrontierCorruptionException(Path path, String message) {
        super(formatMessage(path, message));
        this.path = path;
    }

    public FrontierCorruptionException(Path path, String message, Throwable cause) {
        super(formatMessage(path, message), cause);
        this.path = path;
    }

    /**
     * @return location of the corrupt frontier record
     */
    public Path getPath() {
        return path;
    }

    private static String formatMessage(Path path, String message) {
        return "Frontier at " + path + " is corrupt: " + message;
    }
}
