package org.pipesteps.datapipeline.api.batch;

/**
 * One bounded chunk of the source and its payload.
 * <p>
 * {@code batchId} and {@code startRow} denote the chunk's <em>position</em> in the source and
 * never change while the batch moves through the steps; only {@code data} (and, when rows are
 * removed, {@code endRow}) may differ between a step's input and output. Identity for all
 * frontier bookkeeping is {@code batchId} alone.
 *
 * @param batchId Non-negative id, strictly increasing across successive fetches of a run
 * @param startRow First row of the chunk in the source's global row order (inclusive)
 * @param endRow Last row of the chunk (inclusive); {@code startRow - 1} for an empty batch
 * @param data The records of this chunk
 */
public record Batch(long batchId, long startRow, long endRow, Table data) {

    public Batch {
        if (batchId < 0) {
            throw new IllegalArgumentException("batchId must be non-negative: " + batchId);
        }
        if (startRow < 0) {
            throw new IllegalArgumentException("startRow must be non-negative: " + startRow);
        }
        if (endRow < startRow - 1) {
            throw new IllegalArgumentException(String.format(
                "endRow %d is before startRow - 1 (startRow=%d)", endRow, startRow));
        }
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
    }

    /**
     * Creates a batch whose row range is derived from its data: {@code endRow = startRow + rows - 1}.
     *
     * @param batchId batch id
     * @param startRow first row in the source
     * @param data payload
     * @return the new batch
     */
    public static Batch of(long batchId, long startRow, Table data) {
        return new Batch(batchId, startRow, startRow + data.rowCount() - 1, data);
    }

    /**
     * Number of records currently in this batch. May shrink as steps remove rows.
     *
     * @return the row count of {@link #data()}
     */
    public int size() {
        return data.rowCount();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Returns a batch at the same position carrying new data.
     * <p>
     * If the row count is unchanged the row range is kept as is; otherwise {@code endRow} is
     * recomputed as {@code startRow + rows - 1} to reflect the surviving rows.
     *
     * @param newData transformed payload
     * @return the new batch
     */
    public Batch withData(Table newData) {
        if (newData.rowCount() == data.rowCount()) {
            return new Batch(batchId, startRow, endRow, newData);
        }
        return of(batchId, startRow, newData);
    }

    @Override
    public String toString() {
        return "Batch(id=" + batchId + ", rows=" + startRow + "-" + endRow + ", size=" + size() + ")";
    }
}
