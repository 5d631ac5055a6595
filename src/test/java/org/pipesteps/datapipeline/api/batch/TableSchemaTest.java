package org.pipesteps.datapipeline.api.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TableSchemaTest {

    @Test
    void testDuplicateColumnNamesRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableSchema.builder()
            .column("a", ColumnType.BIGINT)
            .column("a", ColumnType.DOUBLE)
            .build());
    }

    @Test
    void testBlankColumnNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> Column.of(" ", ColumnType.BIGINT));
        assertThrows(IllegalArgumentException.class, () -> Column.of("a", null));
    }

    @Test
    void testIndexLookup() {
        TableSchema schema = TableSchema.of(Column.of("a", ColumnType.BIGINT), Column.of("b", ColumnType.VARCHAR));

        assertEquals(Optional.of(1), schema.indexOf("b"));
        assertEquals(Optional.empty(), schema.indexOf("c"));
        assertEquals(0, schema.requireIndex("a"));
        assertTrue(schema.hasColumn("a"));
        assertFalse(schema.hasColumn("c"));
        assertThrows(IllegalArgumentException.class, () -> schema.requireIndex("c"));
        assertEquals("[a:BIGINT, b:VARCHAR]", schema.toString());
    }

    @Test
    void testColumnTypeTagsAreStable() {
        assertEquals(1, ColumnType.BIGINT.getTag());
        assertEquals(2, ColumnType.INTEGER.getTag());
        assertEquals(3, ColumnType.DOUBLE.getTag());
        assertEquals(4, ColumnType.VARCHAR.getTag());
        assertEquals(5, ColumnType.BOOLEAN.getTag());
        for (ColumnType type : ColumnType.values()) {
            assertEquals(type, ColumnType.fromTag(type.getTag()));
        }
        assertThrows(IllegalArgumentException.class, () -> ColumnType.fromTag((byte) 99));
    }

    @Test
    void testColumnTypeAccepts() {
        assertTrue(ColumnType.BIGINT.accepts(1L));
        assertTrue(ColumnType.BIGINT.accepts(null));
        assertFalse(ColumnType.BIGINT.accepts(1));
        assertFalse(ColumnType.DOUBLE.accepts(1L));
        assertTrue(ColumnType.DOUBLE.isNumeric());
        assertFalse(ColumnType.VARCHAR.isNumeric());
    }
}
