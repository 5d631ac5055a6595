package org.pipesteps.datapipeline.resources.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pipesteps.datapipeline.api.batch.ColumnType;
import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.batch.TableSchema;

@Tag("unit")
class ColumnarTableFormatTest {

    private static byte[] encode(Table table) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ColumnarTableFormat.write(table, out);
        return out.toByteArray();
    }

    @Test
    void preservesAllTypesAndNulls() throws IOException {
        TableSchema schema = TableSchema.builder()
            .column("id", ColumnType.BIGINT)
            .column("count", ColumnType.INTEGER)
            .column("value", ColumnType.DOUBLE)
            .column("label", ColumnType.VARCHAR)
            .column("flag", ColumnType.BOOLEAN)
            .build();
        Table.Builder builder = Table.builder(schema);
        // More than 8 rows so the null bitmap spans several bytes
        for (long i = 0; i < 19; i++) {
            builder.addRow(
                i,
                i % 3 == 0 ? null : (int) i,
                i % 4 == 0 ? null : i * 0.5,
                i % 5 == 0 ? null : "läbel-" + i,
                i % 7 == 0 ? null : i % 2 == 0);
        }
        Table table = builder.build();

        Table decoded = ColumnarTableFormat.read(new ByteArrayInputStream(encode(table)));

        assertThat(decoded).isEqualTo(table);
        assertThat(decoded.value(0, "count")).isNull();
        assertThat(decoded.value(1, "label")).isEqualTo("läbel-1");
    }

    @Test
    void preservesSchemaOfEmptyTable() throws IOException {
        Table empty = Table.empty(TableSchema.builder().column("id", ColumnType.BIGINT).build());

        Table decoded = ColumnarTableFormat.read(new ByteArrayInputStream(encode(empty)));

        assertThat(decoded.isEmpty()).isTrue();
        assertThat(decoded.schema()).isEqualTo(empty.schema());
    }

    @Test
    void rejectsForeignData() {
        byte[] garbage = "definitely not a table".getBytes();

        assertThatThrownBy(() -> ColumnarTableFormat.read(new ByteArrayInputStream(garbage)))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("bad magic");
    }

    @Test
    void rejectsTruncatedData() throws IOException {
        Table table = Table.builder(TableSchema.builder().column("label", ColumnType.VARCHAR).build())
            .addRow("alpha").addRow("beta").build();
        byte[] bytes = encode(table);
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);

        assertThatThrownBy(() -> ColumnarTableFormat.read(new ByteArrayInputStream(truncated)))
            .isInstanceOf(IOException.class);
    }
}
