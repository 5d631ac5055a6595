package org.pipesteps.datapipeline.api.batch;

/**
 * Supported column types for batch tables.
 * <p>
 * Each type carries the Java class of its non-null cell values and a stable one-byte tag
 * used by the columnar checkpoint format. Tags must never be renumbered, otherwise
 * existing checkpoint artifacts become unreadable.
 */
public enum ColumnType {
    /**
     * 64-bit signed integer. Use for row numbers, counters, IDs.
     */
    BIGINT(Long.class, (byte) 1),

    /**
     * 32-bit signed integer. Use for counts, small numbers.
     */
    INTEGER(Integer.class, (byte) 2),

    /**
     * 64-bit floating point. Use for measurements, ratios, derived features.
     */
    DOUBLE(Double.class, (byte) 3),

    /**
     * Variable-length string. Use for labels, categories.
     */
    VARCHAR(String.class, (byte) 4),

    /**
     * Boolean (true/false).
     */
    BOOLEAN(Boolean.class, (byte) 5);

    private final Class<?> javaType;
    private final byte tag;

    ColumnType(Class<?> javaType, byte tag) {
        this.javaType = javaType;
        this.tag = tag;
    }

    /**
     * Returns the Java class of non-null values in a column of this type.
     *
     * @return value class (e.g., {@code Long.class} for {@link #BIGINT})
     */
    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * Returns the wire tag written to checkpoint artifacts.
     *
     * @return the one-byte type tag
     */
    public byte getTag() {
        return tag;
    }

    /**
     * Returns true for the integral and floating point types.
     *
     * @return true if values of this type are {@link Number}s
     */
    public boolean isNumeric() {
        return this == BIGINT || this == INTEGER || this == DOUBLE;
    }

    /**
     * Checks whether a cell value is acceptable for this type. {@code null} is always accepted.
     *
     * @param value the cell value
     * @return true if the value is null or an instance of {@link #getJavaType()}
     */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }

    /**
     * Resolves a type from its wire tag.
     *
     * @param tag the tag read from a checkpoint artifact
     * @return the matching type
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static ColumnType fromTag(byte tag) {
        for (ColumnType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type tag: " + tag);
    }
}
