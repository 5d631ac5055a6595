package org.pipesteps.datapipeline.services.fetchers;

import java.util.Optional;

import org.pipesteps.datapipeline.api.batch.Batch;
import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;

/**
 * Serves batches from an in-memory table. Batch {@code N} holds rows
 * {@code [N * batchSize, (N + 1) * batchSize)}; the last batch may be shorter.
 */
public class TableBatchFetcher implements IBatchFetcher {

    private final Table table;

    public TableBatchFetcher(Table table) {
        if (table == null) {
            throw new IllegalArgumentException("Table must not be null");
        }
        this.table = table;
    }

    @Override
    public Optional<Batch> fetch(long batchId, int batchSize) {
        if (batchId < 0) {
            throw new IllegalArgumentException("batchId must be non-negative: " + batchId);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        long start = Math.multiplyExact(batchId, (long) batchSize);
        if (start >= table.rowCount()) {
            return Optional.empty();
        }
        Table slice = table.slice((int) start, (int) Math.min(start + batchSize, table.rowCount()));
        return Optional.of(Batch.of(batchId, start, slice));
    }
}
