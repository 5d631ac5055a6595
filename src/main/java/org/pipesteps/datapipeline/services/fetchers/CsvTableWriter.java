package org.pipesteps.datapipeline.services.fetchers;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.utils.AtomicFiles;

/**
 * Writes tables as CSV that {@link CsvBatchFetcher} reads back: a header row, then one record
 * per row. Nulls become empty fields; empty strings are written as {@code ""}.
 */
public final class CsvTableWriter {

    private CsvTableWriter() {
    }

    /**
     * Writes a table to a file atomically.
     *
     * @param table the table
     * @param target destination file, replaced if it exists
     * @param delimiter field delimiter
     * @throws IOException if the file cannot be written
     */
    public static void write(Table table, Path target, char delimiter) throws IOException {
        AtomicFiles.write(target, out -> {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            write(table, writer, delimiter);
            writer.flush();
        });
    }

    public static void write(Table table, Writer writer, char delimiter) throws IOException {
        List<String> names = table.schema().columnNames();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                writer.write(delimiter);
            }
            writer.write(escape(names.get(i), delimiter));
        }
        writer.write('\n');

        for (int r = 0; r < table.rowCount(); r++) {
            Object[] row = table.row(r);
            for (int i = 0; i < row.length; i++) {
                if (i > 0) {
                    writer.write(delimiter);
                }
                if (row[i] != null) {
                    writer.write(escape(row[i].toString(), delimiter));
                }
            }
            writer.write('\n');
        }
    }

    static String escape(String value, char delimiter) {
        boolean needsQuotes = value.isEmpty()
            || value.indexOf(delimiter) >= 0
            || value.indexOf('"') >= 0
            || value.indexOf('\n') >= 0
            || value.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
