package org.pipesteps.datapipeline.services.fetchers;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.pipesteps.datapipeline.api.batch.Batch;
import org.pipesteps.datapipeline.api.batch.Column;
import org.pipesteps.datapipeline.api.batch.ColumnType;
import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.batch.TableSchema;
import org.pipesteps.datapipeline.api.exceptions.FetchException;
import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Streams batches from a CSV file with a header row.
 * <p>
 * <b>Options:</b>
 * <ul>
 *   <li>{@code file} - required, path of the CSV file</li>
 *   <li>{@code delimiter} - optional, single character (default {@code ","})</li>
 *   <li>{@code columns} - optional list of {@code { name, type }}; selects and types the named
 *       header columns in the given order. Without it, all header columns are read and their
 *       types are inferred from the first {@code schemaSampleRows} records.</li>
 *   <li>{@code schemaSampleRows} - optional, records sampled for inference (default 100)</li>
 * </ul>
 * <p>
 * Inference picks the narrowest of BIGINT, DOUBLE, BOOLEAN that accepts every sampled non-empty
 * cell, otherwise VARCHAR. Empty cells are null. Blank lines are skipped, except in a single-column
 * file where each one is a null value. The file is opened lazily on the first fetch.
 * <p>
 * Fetching the id after the previous one continues the open reader; any other id reopens the
 * file and skips {@code batchId * batchSize} records, so every id always yields the same rows.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe.
 */
public class CsvBatchFetcher implements IBatchFetcher {

    private static final Logger log = LoggerFactory.getLogger(CsvBatchFetcher.class);

    static final int DEFAULT_SCHEMA_SAMPLE_ROWS = 100;

    private final String name;
    private final Path file;
    private final char delimiter;
    private final int schemaSampleRows;
    private final List<Column> declaredColumns;

    private TableSchema schema;
    private int[] sourceIndexes;
    private int headerWidth;

    private CsvRecordReader reader;
    private long expectedBatchId = -1;
    private int expectedBatchSize = -1;

    public CsvBatchFetcher(String name, Config options) {
        this.name = name;
        if (!options.hasPath("file")) {
            throw new IllegalArgumentException("CSV source '" + name + "' requires 'file'");
        }
        this.file = Paths.get(options.getString("file"));

        String delimiterOption = options.hasPath("delimiter") ? options.getString("delimiter") : ",";
        if (delimiterOption.length() != 1) {
            throw new IllegalArgumentException("delimiter must be a single character: '" + delimiterOption + "'");
        }
        this.delimiter = delimiterOption.charAt(0);

        this.schemaSampleRows = options.hasPath("schemaSampleRows")
            ? options.getInt("schemaSampleRows") : DEFAULT_SCHEMA_SAMPLE_ROWS;
        if (schemaSampleRows <= 0) {
            throw new IllegalArgumentException("schemaSampleRows must be positive: " + schemaSampleRows);
        }

        if (options.hasPath("columns")) {
            List<Column> columns = new ArrayList<>();
            for (Config column : options.getConfigList("columns")) {
                String type = column.getString("type").toUpperCase(Locale.ROOT);
                try {
                    columns.add(Column.of(column.getString("name"), ColumnType.valueOf(type)));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown column type '" + type + "' for column '"
                        + column.getString("name") + "'. Supported: " + Arrays.toString(ColumnType.values()), e);
                }
            }
            // Validates uniqueness
            TableSchema.of(columns);
            this.declaredColumns = List.copyOf(columns);
        } else {
            this.declaredColumns = null;
        }
    }

    @Override
    public Optional<Batch> fetch(long batchId, int batchSize) throws IOException {
        if (batchId < 0 || batchSize <= 0) {
            throw new IllegalArgumentException("Invalid fetch request: batchId=" + batchId + ", batchSize=" + batchSize);
        }
        try {
            ensureSchema(batchId);
            if (reader == null || batchId != expectedBatchId || batchSize != expectedBatchSize) {
                position(Math.multiplyExact(batchId, (long) batchSize));
            }

            List<Object[]> rows = new ArrayList<>(batchSize);
            List<String> record;
            while (rows.size() < batchSize && (record = reader.next()) != null) {
                rows.add(toRow(record, batchId));
            }
            expectedBatchId = batchId + 1;
            expectedBatchSize = batchSize;

            if (rows.isEmpty()) {
                log.debug("CSV source '{}' exhausted at batch {}", name, batchId);
                return Optional.empty();
            }
            return Optional.of(Batch.of(batchId, batchId * batchSize, new Table(schema, rows)));
        } catch (IOException | RuntimeException e) {
            closeReader();
            throw e;
        }
    }

    /**
     * Returns the schema of produced tables, resolving it from the file if necessary.
     *
     * @return the table schema
     * @throws IOException if the file cannot be read
     */
    public TableSchema getSchema() throws IOException {
        ensureSchema(0);
        return schema;
    }

    @Override
    public void close() throws IOException {
        closeReader();
    }

    private void ensureSchema(long batchId) throws IOException {
        if (schema != null) {
            return;
        }
        try (CsvRecordReader headerReader = open()) {
            List<String> header = readHeader(headerReader);
            if (header == null) {
                throw new FetchException(batchId, "CSV file " + file + " has no header row");
            }
            headerWidth = header.size();

            if (declaredColumns != null) {
                sourceIndexes = new int[declaredColumns.size()];
                for (int i = 0; i < declaredColumns.size(); i++) {
                    int index = header.indexOf(declaredColumns.get(i).name());
                    if (index < 0) {
                        throw new FetchException(batchId, String.format(
                            "column '%s' not found in header of %s %s", declaredColumns.get(i).name(), file, header));
                    }
                    sourceIndexes[i] = index;
                }
                schema = TableSchema.of(declaredColumns);
            } else {
                List<List<String>> samples = new ArrayList<>();
                List<String> record;
                while (samples.size() < schemaSampleRows && (record = headerReader.next()) != null) {
                    samples.add(record);
                }
                List<Column> columns = new ArrayList<>(header.size());
                sourceIndexes = new int[header.size()];
                for (int i = 0; i < header.size(); i++) {
                    if (header.get(i) == null || header.get(i).isBlank()) {
                        throw new FetchException(batchId, "CSV header of " + file + " has an empty column name at position " + i);
                    }
                    columns.add(Column.of(header.get(i).trim(), inferType(samples, i)));
                    sourceIndexes[i] = i;
                }
                schema = TableSchema.of(columns);
            }
        }
        log.debug("CSV source '{}' schema: {}", name, schema);
    }

    private void position(long skipRecords) throws IOException {
        closeReader();
        reader = open();
        readHeader(reader);
        for (long i = 0; i < skipRecords; i++) {
            if (reader.next() == null) {
                return;
            }
        }
    }

    private static List<String> readHeader(CsvRecordReader csvReader) throws IOException {
        List<String> header = csvReader.next();
        if (header != null && header.size() == 1) {
            // In a single-column file an empty line is a null value
            csvReader.setSkipBlankLines(false);
        }
        return header;
    }

    private CsvRecordReader open() throws IOException {
        BufferedReader buffered = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        return new CsvRecordReader(buffered, delimiter);
    }

    private Object[] toRow(List<String> record, long batchId) {
        if (record.size() != headerWidth) {
            throw new FetchException(batchId, String.format(
                "record %d of %s has %d fields, header has %d", reader.getRecordNumber(), file, record.size(), headerWidth));
        }
        Object[] row = new Object[schema.size()];
        for (int i = 0; i < row.length; i++) {
            Column column = schema.column(i);
            String cell = record.get(sourceIndexes[i]);
            try {
                row[i] = parse(cell, column.type());
            } catch (IllegalArgumentException e) {
                throw new FetchException(batchId, String.format(
                    "record %d, column '%s': cannot parse '%s' as %s", reader.getRecordNumber(), column.name(), cell, column.type()), e);
            }
        }
        return row;
    }

    static Object parse(String cell, ColumnType type) {
        if (cell == null) {
            return null;
        }
        if (type == ColumnType.VARCHAR) {
            return cell;
        }
        String trimmed = cell.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return switch (type) {
            case BIGINT -> Long.parseLong(trimmed);
            case INTEGER -> Integer.parseInt(trimmed);
            case DOUBLE -> Double.parseDouble(trimmed);
            case BOOLEAN -> parseBoolean(trimmed);
            case VARCHAR -> cell;
        };
    }

    private static Boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (value.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean: " + value);
    }

    static ColumnType inferType(List<List<String>> samples, int index) {
        boolean sawValue = false;
        boolean isLong = true;
        boolean isDouble = true;
        boolean isBoolean = true;
        for (List<String> record : samples) {
            if (index >= record.size() || record.get(index) == null || record.get(index).isBlank()) {
                continue;
            }
            String value = record.get(index).trim();
            sawValue = true;
            if (isLong && !accepts(value, ColumnType.BIGINT)) {
                isLong = false;
            }
            if (isDouble && !accepts(value, ColumnType.DOUBLE)) {
                isDouble = false;
            }
            if (isBoolean && !accepts(value, ColumnType.BOOLEAN)) {
                isBoolean = false;
            }
        }
        if (!sawValue) {
            return ColumnType.VARCHAR;
        }
        if (isLong) {
            return ColumnType.BIGINT;
        }
        if (isDouble) {
            return ColumnType.DOUBLE;
        }
        return isBoolean ? ColumnType.BOOLEAN : ColumnType.VARCHAR;
    }

    private static boolean accepts(String value, ColumnType type) {
        try {
            parse(value, type);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void closeReader() throws IOException {
        expectedBatchId = -1;
        if (reader != null) {
            CsvRecordReader toClose = reader;
            reader = null;
            toClose.close();
        }
    }
}
