package org.pipesteps.datapipeline.api.exceptions;

/**
 * Thrown when the batch fetcher fails or returns a malformed batch.
 * <p>
 * The frontier is left at the last committed batch, so a resumed run fetches
 * {@link #getBatchId()} again.
 */
public class FetchException extends PipelineException {

    private final long batchId;

    public FetchException(long batchId, String message) {
        super(formatMessage(batchId, message));
        this.batchId = batchId;
    }

    public FetchException(long batchId, String message, Throwable cause) {
        super(formatMessage(batchId, message), cause);
        this.batchId = batchId;
    }

    /**
     * @return id of the batch whose fetch failed
     */
    public long getBatchId() {
        return batchId;
    }

    private static String formatMessage(long batchId, String message) {
        return "Fetch of batch " + batchId + " failed: " + message;
    }
}
