package org.pipesteps.datapipeline.api.batch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable, ordered collection of typed records: the payload of a {@link Batch}.
 * <p>
 * A table is a {@link TableSchema} plus rows. Each row is an {@code Object[]} with one cell
 * per column; a cell is either {@code null} or an instance of its column type's Java class.
 * All cells are validated on construction, so every table reaching a step or the checkpoint
 * format is well-typed.
 * <p>
 * Transformations ({@link #filterRows}, {@link #withColumn}, {@link #slice}, {@link #dropNulls})
 * return new tables and never modify the receiver. Rows handed to predicates and functions
 * are copies.
 * <p>
 * <strong>Thread Safety:</strong> Immutable and therefore safe to share.
 */
public final class Table {

    private final TableSchema schema;
    private final List<Object[]> rows;

    /**
     * Creates a table, copying and validating every row.
     *
     * @param schema Schema of the rows (must not be null)
     * @param rows Rows in source order (must not be null)
     * @throws IllegalArgumentException if a row has the wrong arity or a cell the wrong type
     */
    public Table(TableSchema schema, List<Object[]> rows) {
        if (schema == null) {
            throw new IllegalArgumentException("Schema must not be null");
        }
        if (rows == null) {
            throw new IllegalArgumentException("Rows must not be null");
        }
        this.schema = schema;
        List<Object[]> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object[] row = rows.get(i);
            validateRow(schema, row, i);
            copy.add(row.clone());
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    // Rows already validated and owned by this instance.
    private Table(TableSchema schema, List<Object[]> trustedRows, boolean trusted) {
        this.schema = schema;
        this.rows = Collections.unmodifiableList(trustedRows);
    }

    public static Table empty(TableSchema schema) {
        return new Table(schema, List.of());
    }

    public static Builder builder(TableSchema schema) {
        return new Builder(schema);
    }

    public TableSchema schema() {
        return schema;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns a copy of one row.
     *
     * @param index row index (0-based)
     * @return the cells of the row, in schema order
     */
    public Object[] row(int index) {
        return rows.get(index).clone();
    }

    /**
     * Returns a single cell.
     *
     * @param rowIndex row index (0-based)
     * @param columnName column name
     * @return the cell value, possibly null
     */
    public Object value(int rowIndex, String columnName) {
        return rows.get(rowIndex)[schema.requireIndex(columnName)];
    }

    /**
     * Returns all values of one column in row order.
     *
     * @param columnName column name
     * @return unmodifiable list of cell values (may contain nulls)
     */
    public List<Object> columnValues(String columnName) {
        int index = schema.requireIndex(columnName);
        List<Object> values = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            values.add(row[index]);
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Keeps the rows matching a predicate, preserving order.
     *
     * @param predicate test applied to a copy of each row
     * @return a new table with the same schema
     */
    public Table filterRows(Predicate<Object[]> predicate) {
        List<Object[]> kept = new ArrayList<>();
        for (Object[] row : rows) {
            if (predicate.test(row.clone())) {
                kept.add(row);
            }
        }
        return new Table(schema, kept, true);
    }

    /**
     * Adds a computed column, or replaces the column of the same name in place.
     *
     * @param column the column to add or replace
     * @param compute function from a copy of the current row to the new cell value
     * @return a new table with the extended schema
     * @throws IllegalArgumentException if a computed value does not match the column type
     */
    public Table withColumn(Column column, Function<Object[], Object> compute) {
        int existing = schema.indexOf(column.name()).orElse(-1);
        List<Column> columns = new ArrayList<>(schema.columns());
        if (existing >= 0) {
            columns.set(existing, column);
        } else {
            columns.add(column);
        }
        TableSchema newSchema = TableSchema.of(columns);

        List<Object[]> newRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object[] row = rows.get(i);
            Object value = compute.apply(row.clone());
            if (!column.type().accepts(value)) {
                throw new IllegalArgumentException(String.format(
                    "Computed value %s (%s) in row %d does not match column '%s' of type %s",
                    value, value.getClass().getSimpleName(), i, column.name(), column.type()));
            }
            Object[] newRow;
            if (existing >= 0) {
                newRow = row.clone();
                newRow[existing] = value;
            } else {
                newRow = Arrays.copyOf(row, row.length + 1);
                newRow[row.length] = value;
            }
            newRows.add(newRow);
        }
        return new Table(newSchema, newRows, true);
    }

    /**
     * Returns the rows in {@code [fromIndex, toIndex)}; bounds are clamped to the table.
     *
     * @param fromIndex first row (inclusive)
     * @param toIndex last row (exclusive)
     * @return a new table with the same schema
     */
    public Table slice(int fromIndex, int toIndex) {
        int from = Math.max(0, Math.min(fromIndex, rows.size()));
        int to = Math.max(from, Math.min(toIndex, rows.size()));
        return new Table(schema, new ArrayList<>(rows.subList(from, to)), true);
    }

    /**
     * Drops rows containing a null in any of the given columns.
     *
     * @param columnNames columns to check; empty means all columns
     * @return a new table with the same schema
     */
    public Table dropNulls(Collection<String> columnNames) {
        int[] indexes;
        if (columnNames == null || columnNames.isEmpty()) {
            indexes = new int[schema.size()];
            for (int i = 0; i < indexes.length; i++) {
                indexes[i] = i;
            }
        } else {
            indexes = columnNames.stream().mapToInt(schema::requireIndex).toArray();
        }
        List<Object[]> kept = new ArrayList<>();
        for (Object[] row : rows) {
            boolean hasNull = false;
            for (int index : indexes) {
                if (row[index] == null) {
                    hasNull = true;
                    break;
                }
            }
            if (!hasNull) {
                kept.add(row);
            }
        }
        return new Table(schema, kept, true);
    }

    /**
     * Concatenates tables in list order.
     *
     * @param tables tables with identical schemas (must not be empty)
     * @return the combined table
     * @throws IllegalArgumentException if the list is empty or the schemas differ
     */
    public static Table concat(List<Table> tables) {
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("Cannot concatenate an empty list of tables");
        }
        TableSchema schema = tables.get(0).schema();
        int total = 0;
        for (int i = 0; i < tables.size(); i++) {
            Table table = tables.get(i);
            if (!schema.equals(table.schema())) {
                throw new IllegalArgumentException(String.format(
                    "Schema mismatch at table %d: expected %s but was %s", i, schema, table.schema()));
            }
            total += table.rowCount();
        }
        List<Object[]> combined = new ArrayList<>(total);
        for (Table table : tables) {
            combined.addAll(table.rows);
        }
        return new Table(schema, combined, true);
    }

    private static void validateRow(TableSchema schema, Object[] row, int rowIndex) {
        if (row == null) {
            throw new IllegalArgumentException("Row " + rowIndex + " is null");
        }
        if (row.length != schema.size()) {
            throw new IllegalArgumentException(String.format(
                "Row %d has %d cells but schema has %d columns", rowIndex, row.length, schema.size()));
        }
        for (int c = 0; c < row.length; c++) {
            Column column = schema.column(c);
            if (!column.type().accepts(row[c])) {
                throw new IllegalArgumentException(String.format(
                    "Row %d, column '%s': expected %s but got %s",
                    rowIndex, column.name(), column.type(), row[c].getClass().getSimpleName()));
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        if (!schema.equals(other.schema) || rows.size() != other.rows.size()) {
            return false;
        }
        for (int i = 0; i < rows.size(); i++) {
            if (!Arrays.equals(rows.get(i), other.rows.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = schema.hashCode();
        for (Object[] row : rows) {
            result = 31 * result + Arrays.hashCode(row);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Table(columns=" + schema + ", rows=" + rows.size() + ")";
    }

    /**
     * Row-by-row builder.
     */
    public static final class Builder {
        private final TableSchema schema;
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(TableSchema schema) {
            this.schema = schema;
        }

        public Builder addRow(Object... cells) {
            rows.add(cells);
            return this;
        }

        public Table build() {
            return new Table(schema, rows);
        }
    }
}
