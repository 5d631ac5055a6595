package org.pipesteps.datapipeline.api.steps;

import org.pipesteps.datapipeline.api.batch.Batch;

/**
 * One transformation stage of a batch pipeline.
 * <p>
 * A step receives the output of the previous step (or the fetched batch for the first step)
 * and returns a batch at the same position: same {@code batchId} and {@code startRow}. Steps
 * that remove rows return a batch with updated {@code endRow}, see {@link Batch#withData}.
 * <p>
 * <strong>Idempotence:</strong> After a crash the in-flight batch is recomputed from scratch by
 * every step, so {@link #process} must be safe to call repeatedly with the same input and must
 * not depend on, or change, externally visible state.
 * <p>
 * <strong>Naming:</strong> {@link #getName()} identifies the step's checkpoint artifacts and its
 * entry in the frontier. Names must be unique within a pipeline and stable across runs.
 */
public interface IBatchStep {

    /**
     * @return the unique, stable name of this step
     */
    String getName();

    /**
     * Transforms one batch.
     *
     * @param batch The input batch (never null)
     * @return The transformed batch at the same position (never null)
     * @throws Exception to signal failure; the pipeline aborts the current batch attempt
     */
    Batch process(Batch batch) throws Exception;
}
