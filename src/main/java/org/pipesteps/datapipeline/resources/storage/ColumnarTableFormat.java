package org.pipesteps.datapipeline.resources.storage;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.pipesteps.datapipeline.api.batch.Column;
import org.pipesteps.datapipeline.api.batch.ColumnType;
import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.batch.TableSchema;

/**
 * Binary columnar encoding of a {@link Table}, used for checkpoint artifacts.
 * <p>
 * <b>Layout</b> (big-endian, as written by {@link DataOutputStream}):
 * <pre>
 * int    magic        0x50535442 ("PSTB")
 * byte   version      1
 * int    columnCount
 * int    rowCount
 * repeated columnCount times:
 *   string name       (int length + UTF-8 bytes)
 *   byte   typeTag    see {@link ColumnType#getTag()}
 *   bytes  nullBitmap ceil(rowCount / 8) bytes, bit set = null, LSB first
 *   values            the non-null cells of the column, in row order
 * </pre>
 * Values are encoded as {@code long} (BIGINT), {@code int} (INTEGER), {@code double} (DOUBLE),
 * {@code boolean} (BOOLEAN) or string (VARCHAR). Storing each column contiguously keeps values
 * of one type together, which is what makes the artifacts compress well.
 * <p>
 * This class only encodes and decodes; compression and atomic file handling belong to
 * {@link FileSystemCheckpointStorage}.
 */
public final class ColumnarTableFormat {

    static final int MAGIC = 0x50535442;
    static final byte VERSION = 1;

    private ColumnarTableFormat() {
    }

    /**
     * Encodes a table. The stream is flushed but not closed.
     *
     * @param table table to encode
     * @param out target stream
     * @throws IOException if writing fails
     */
    public static void write(Table table, OutputStream out) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        TableSchema schema = table.schema();
        int rows = table.rowCount();

        data.writeInt(MAGIC);
        data.writeByte(VERSION);
        data.writeInt(schema.size());
        data.writeInt(rows);

        for (Column column : schema.columns()) {
            writeString(data, column.name());
            data.writeByte(column.type().getTag());

            List<Object> values = table.columnValues(column.name());
            byte[] nullBitmap = new byte[(rows + 7) / 8];
            for (int r = 0; r < rows; r++) {
                if (values.get(r) == null) {
                    nullBitmap[r >>> 3] |= (byte) (1 << (r & 7));
                }
            }
            data.write(nullBitmap);

            for (Object value : values) {
                if (value != null) {
                    writeValue(data, column.type(), value);
                }
            }
        }
        data.flush();
    }

    /**
     * Decodes a table.
     *
     * @param in source stream, positioned at the magic number
     * @return the decoded table
     * @throws IOException if the stream is truncated or not a columnar table
     */
    public static Table read(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);

        int magic = data.readInt();
        if (magic != MAGIC) {
            throw new IOException(String.format("Not a columnar table: bad magic 0x%08X", magic));
        }
        byte version = data.readByte();
        if (version != VERSION) {
            throw new IOException("Unsupported columnar table version: " + version);
        }
        int columnCount = data.readInt();
        int rowCount = data.readInt();
        if (columnCount < 0 || rowCount < 0) {
            throw new IOException(String.format(
                "Invalid columnar table header: columns=%d, rows=%d", columnCount, rowCount));
        }

        List<Column> columns = new ArrayList<>(columnCount);
        Object[][] cells = new Object[rowCount][columnCount];
        for (int c = 0; c < columnCount; c++) {
            String name = readString(data);
            ColumnType type;
            try {
                type = ColumnType.fromTag(data.readByte());
            } catch (IllegalArgumentException e) {
                throw new IOException("Column '" + name + "': " + e.getMessage(), e);
            }
            columns.add(new Column(name, type));

            byte[] nullBitmap = new byte[(rowCount + 7) / 8];
            data.readFully(nullBitmap);
            for (int r = 0; r < rowCount; r++) {
                boolean isNull = (nullBitmap[r >>> 3] & (1 << (r & 7))) != 0;
                cells[r][c] = isNull ? null : readValue(data, type);
            }
        }

        try {
            List<Object[]> rows = new ArrayList<>(rowCount);
            for (Object[] row : cells) {
                rows.add(row);
            }
            return new Table(TableSchema.of(columns), rows);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid columnar table: " + e.getMessage(), e);
        }
    }

    private static void writeValue(DataOutputStream data, ColumnType type, Object value) throws IOException {
        switch (type) {
            case BIGINT -> data.writeLong((Long) value);
            case INTEGER -> data.writeInt((Integer) value);
            case DOUBLE -> data.writeDouble((Double) value);
            case BOOLEAN -> data.writeBoolean((Boolean) value);
            case VARCHAR -> writeString(data, (String) value);
        }
    }

    private static Object readValue(DataInputStream data, ColumnType type) throws IOException {
        return switch (type) {
            case BIGINT -> data.readLong();
            case INTEGER -> data.readInt();
            case DOUBLE -> data.readDouble();
            case BOOLEAN -> data.readBoolean();
            case VARCHAR -> readString(data);
        };
    }

    private static void writeString(DataOutputStream data, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        data.writeInt(bytes.length);
        data.write(bytes);
    }

    private static String readString(DataInputStream data) throws IOException {
        int length = data.readInt();
        if (length < 0) {
            throw new IOException("Invalid string length: " + length);
        }
        byte[] bytes = new byte[length];
        data.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
