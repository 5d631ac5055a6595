package org.pipesteps.datapipeline.services.steps;

import java.util.Map;

import org.pipesteps.datapipeline.api.batch.Batch;
import org.pipesteps.datapipeline.api.batch.Column;
import org.pipesteps.datapipeline.api.batch.ColumnType;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Adds a column computed as {@code sourceColumn * multiplier}.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code sourceColumn} - required, a numeric column</li>
 *   <li>{@code multiplier} - optional, default 2</li>
 *   <li>{@code newColumn} - optional, default "calculated"; an existing column of that name
 *       is replaced in place</li>
 * </ul>
 * An integral source multiplied by a whole-number multiplier yields {@link ColumnType#BIGINT},
 * anything else {@link ColumnType#DOUBLE}. Null source values yield null.
 */
public class AddColumnStep extends AbstractBatchStep {

    public static final double DEFAULT_MULTIPLIER = 2;
    public static final String DEFAULT_NEW_COLUMN = "calculated";

    private static final double LONG_RANGE_LIMIT = 0x1p63;

    private final String sourceColumn;
    private final double multiplier;
    private final String newColumn;

    public AddColumnStep(String name, Config options) {
        super(name, options);
        if (!this.options.hasPath("sourceColumn")) {
            throw new IllegalArgumentException("sourceColumn is required for AddColumnStep '" + name + "'");
        }
        this.sourceColumn = this.options.getString("sourceColumn");
        this.multiplier = this.options.hasPath("multiplier") ? this.options.getDouble("multiplier") : DEFAULT_MULTIPLIER;
        this.newColumn = this.options.hasPath("newColumn") ? this.options.getString("newColumn") : DEFAULT_NEW_COLUMN;
    }

    public AddColumnStep(String name, String sourceColumn, double multiplier, String newColumn) {
        this(name, ConfigFactory.parseMap(Map.of(
            "sourceColumn", sourceColumn,
            "multiplier", multiplier,
            "newColumn", newColumn)));
    }

    @Override
    public Batch process(Batch batch) {
        int sourceIndex = batch.data().schema().requireIndex(sourceColumn);
        ColumnType sourceType = batch.data().schema().column(sourceIndex).type();
        if (!sourceType.isNumeric()) {
            throw new IllegalArgumentException(String.format(
                "Column '%s' has type %s, expected a numeric column", sourceColumn, sourceType));
        }

        // Whole multipliers outside the long range would be clamped by the cast
        boolean integral = sourceType != ColumnType.DOUBLE && multiplier == Math.rint(multiplier)
            && Math.abs(multiplier) < LONG_RANGE_LIMIT;
        Column target = new Column(newColumn, integral ? ColumnType.BIGINT : ColumnType.DOUBLE);
        long integralMultiplier = (long) multiplier;

        return batch.withData(batch.data().withColumn(target, row -> {
            Number value = (Number) row[sourceIndex];
            if (value == null) {
                return null;
            }
            return integral ? (Object) (value.longValue() * integralMultiplier) : (Object) (value.doubleValue() * multiplier);
        }));
    }
}
