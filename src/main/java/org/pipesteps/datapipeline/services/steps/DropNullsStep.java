package org.pipesteps.datapipeline.services.steps;

import java.util.List;
import java.util.Map;

import org.pipesteps.datapipeline.api.batch.Batch;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Drops rows that contain a null value.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code columns} - optional list of columns to check; all columns if absent or empty</li>
 * </ul>
 * Surviving rows keep their order; the batch's end row shrinks with the row count.
 */
public class DropNullsStep extends AbstractBatchStep {

    private final List<String> columns;

    public DropNullsStep(String name, Config options) {
        super(name, options);
        this.columns = this.options.hasPath("columns") ? List.copyOf(this.options.getStringList("columns")) : List.of();
    }

    public DropNullsStep(String name) {
        this(name, ConfigFactory.empty());
    }

    public DropNullsStep(String name, List<String> columns) {
        this(name, ConfigFactory.parseMap(Map.of("columns", columns)));
    }

    @Override
    public Batch process(Batch batch) {
        return batch.withData(batch.data().dropNulls(columns));
    }
}
