package org.pipesteps.datapipeline.api.fetch;

import java.util.Optional;

import org.pipesteps.datapipeline.api.batch.Batch;

/**
 * Port for pulling bounded chunks from a source too large to hold in memory
 * (a database query, a large file, synthetic test data).
 * <p>
 * <strong>Determinism:</strong> For a given {@code batchId} and {@code batchSize} the fetcher must
 * return identical content on every call, within a run and across runs, since recovery
 * recomputes the in-flight batch from a fresh fetch.
 * <p>
 * <strong>Cancellation:</strong> Returning {@link Optional#empty()} or throwing halts the pipeline
 * loop between batches, never inside one.
 */
@FunctionalInterface
public interface IBatchFetcher extends AutoCloseable {

    /**
     * Fetches one batch.
     *
     * @param batchId Id of the requested batch (0-based)
     * @param batchSize Maximum number of rows in the batch
     * @return The batch with the requested id, or empty when the source is exhausted
     * @throws Exception if the source cannot be read
     */
    Optional<Batch> fetch(long batchId, int batchSize) throws Exception;

    @Override
    default void close() throws Exception {
        // Default no-op for fetchers that don't hold resources
    }
}
