package org.pipesteps.datapipeline.services;

import org.pipesteps.datapipeline.frontier.FrontierSnapshot;

/**
 * Outcome of a successful {@link BatchPipeline#run(boolean)} call.
 *
 * @param startBatchId Id of the first batch fetched by the run
 * @param batchesCommitted Number of batches committed by the run
 * @param rowsCommitted Rows committed by the run (last step output)
 * @param frontier Frontier after the run
 */
public record RunSummary(
    long startBatchId,
    long batchesCommitted,
    long rowsCommitted,
    FrontierSnapshot frontier
) {
}
