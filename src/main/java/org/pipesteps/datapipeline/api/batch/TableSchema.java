package org.pipesteps.datapipeline.api.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered list of uniquely named columns describing the rows of a {@link Table}.
 * <p>
 * Schemas are immutable and compare by value, so two tables produced by the same step
 * for different batches have equal schemas and can be concatenated.
 */
public final class TableSchema {

    private final List<Column> columns;
    private final Map<String, Integer> indexByName;

    private TableSchema(List<Column> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.indexByName = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (indexByName.putIfAbsent(column.name(), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
        }
    }

    public static TableSchema of(List<Column> columns) {
        if (columns == null) {
            throw new IllegalArgumentException("Columns must not be null");
        }
        return new TableSchema(columns);
    }

    public static TableSchema of(Column... columns) {
        return of(List.of(columns));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Column> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }

    public Column column(int index) {
        return columns.get(index);
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).collect(Collectors.toList());
    }

    /**
     * Returns the position of a column.
     *
     * @param name column name
     * @return the index, or empty if the schema has no such column
     */
    public Optional<Integer> indexOf(String name) {
        return Optional.ofNullable(indexByName.get(name));
    }

    /**
     * Returns the position of a column that must exist.
     *
     * @param name column name
     * @return the index
     * @throws IllegalArgumentException if the column does not exist
     */
    public int requireIndex(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column '" + name + "', available: " + columnNames());
        }
        return index;
    }

    public boolean hasColumn(String name) {
        return indexByName.containsKey(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableSchema other)) return false;
        return columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.stream()
            .map(c -> c.name() + ":" + c.type())
            .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * Builder for schemas declared column by column.
     */
    public static final class Builder {
        private final List<Column> columns = new ArrayList<>();

        private Builder() {
        }

        public Builder column(String name, ColumnType type) {
            columns.add(new Column(name, type));
            return this;
        }

        public TableSchema build() {
            return new TableSchema(columns);
        }
    }
}
