package org.pipesteps.datapipeline.api.batch;

/**
 * A named, typed column of a {@link TableSchema}.
 *
 * @param name Column name (non-blank, unique within a schema)
 * @param type Column type
 */
public record Column(String name, ColumnType type) {

    public Column {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Column type must not be null for column '" + name + "'");
        }
    }

    public static Column of(String name, ColumnType type) {
        return new Column(name, type);
    }
}
