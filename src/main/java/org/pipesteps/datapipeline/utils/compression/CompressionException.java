package org.pipesteps.datapipeline.utils.compression;

/**
 * Thrown when the configured compression codec is unknown or cannot be used in this environment
 * (e.g., the zstd native library fails to load).
 */
public class CompressionException extends Exception {

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
