package org.pipesteps.datapipeline.services.steps;

import java.util.Map;

import org.pipesteps.datapipeline.api.batch.Batch;
import org.pipesteps.datapipeline.api.batch.ColumnType;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Keeps rows whose numeric {@code column} is strictly greater than {@code threshold}.
 * Rows with a null value in the column are dropped.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code column} - required, a numeric column</li>
 *   <li>{@code threshold} - required</li>
 * </ul>
 */
public class FilterStep extends AbstractBatchStep {

    private final String column;
    private final double threshold;

    public FilterStep(String name, Config options) {
        super(name, options);
        if (!this.options.hasPath("column") || !this.options.hasPath("threshold")) {
            throw new IllegalArgumentException("column and threshold are required for FilterStep '" + name + "'");
        }
        this.column = this.options.getString("column");
        this.threshold = this.options.getDouble("threshold");
    }

    public FilterStep(String name, String column, double threshold) {
        this(name, ConfigFactory.parseMap(Map.of("column", column, "threshold", threshold)));
    }

    @Override
    public Batch process(Batch batch) {
        int index = batch.data().schema().requireIndex(column);
        ColumnType type = batch.data().schema().column(index).type();
        if (!type.isNumeric()) {
            throw new IllegalArgumentException(String.format(
                "Column '%s' has type %s, expected a numeric column", column, type));
        }
        return batch.withData(batch.data().filterRows(row -> {
            Number value = (Number) row[index];
            return value != null && value.doubleValue() > threshold;
        }));
    }
}
