package org.pipesteps.datapipeline.frontier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only copy of a {@link Frontier}, safe to hand out to callers.
 *
 * @param lastCompletedBatchId Id of the last fully committed batch, or null before any commit
 * @param lastCompletedRow End row of the last committed batch, -1 before any commit
 * @param totalRowsProcessed Sum of the sizes of all committed batches
 * @param stepStates Step name to the last batch id the step committed, in step order
 */
public record FrontierSnapshot(
    Long lastCompletedBatchId,  // nullable - unset before the first commit
    long lastCompletedRow,
    long totalRowsProcessed,
    Map<String, Long> stepStates
) {

    public FrontierSnapshot {
        stepStates = Collections.unmodifiableMap(new LinkedHashMap<>(stepStates));
    }

    /**
     * @return true once at least one batch has been committed
     */
    public boolean hasCommitted() {
        return lastCompletedBatchId != null;
    }

    /**
     * Returns the id a resumed run starts from.
     *
     * @return {@code lastCompletedBatchId + 1}, or 0 before any commit
     */
    public long nextBatchId() {
        return lastCompletedBatchId == null ? 0 : lastCompletedBatchId + 1;
    }

    @Override
    public String toString() {
        return "Frontier(batch_id=" + lastCompletedBatchId + ", row=" + lastCompletedRow
            + ", processed=" + totalRowsProcessed + ")";
    }
}
