package org.pipesteps.datapipeline.services.steps;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pipesteps.datapipeline.api.batch.Batch;
import org.pipesteps.datapipeline.api.batch.ColumnType;
import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.batch.TableSchema;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class DropNullsStepTest {

    private static final TableSchema SCHEMA = TableSchema.builder()
        .column("id", ColumnType.BIGINT)
        .column("value", ColumnType.DOUBLE)
        .column("label", ColumnType.VARCHAR)
        .build();

    private static Batch batch() {
        return Batch.of(1, 10, Table.builder(SCHEMA)
            .addRow(10L, 1.0, "a")
            .addRow(11L, null, "b")
            .addRow(12L, 3.0, null)
            .addRow(13L, 4.0, "d")
            .build());
    }

    @Test
    void dropsRowsWithAnyNull() throws Exception {
        Batch result = new DropNullsStep("drop_nulls").process(batch());

        assertThat(result.data().columnValues("id")).containsExactly(10L, 13L);
        assertThat(result.batchId()).isEqualTo(1);
        assertThat(result.startRow()).isEqualTo(10);
        assertThat(result.endRow()).isEqualTo(11);
    }

    @Test
    void checksOnlyConfiguredColumns() throws Exception {
        DropNullsStep step = new DropNullsStep("drop_nulls",
            ConfigFactory.parseMap(Map.of("columns", List.of("label"))));

        Batch result = step.process(batch());

        assertThat(result.data().columnValues("id")).containsExactly(10L, 11L, 13L);
    }

    @Test
    void keepsRangeWhenNothingDropped() throws Exception {
        Batch input = Batch.of(0, 0, Table.builder(SCHEMA).addRow(0L, 0.0, "x").build());

        Batch result = new DropNullsStep("drop_nulls", List.of()).process(input);

        assertThat(result).isEqualTo(input);
    }
}
