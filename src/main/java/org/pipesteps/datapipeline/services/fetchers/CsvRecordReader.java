package org.pipesteps.datapipeline.services.fetchers;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 record reader.
 * <p>
 * Supports a configurable delimiter, double-quoted fields with {@code ""} escapes, line breaks
 * inside quoted fields, and LF or CRLF record separators. An unquoted empty field is returned
 * as {@code null}; a quoted empty field ({@code ""}) as the empty string. A leading UTF-8 byte order
 * mark is dropped. Blank lines are skipped unless {@link #setSkipBlankLines(boolean)} turns that off,
 * in which case each one is a record with a single {@code null} field.
 */
class CsvRecordReader implements Closeable {

    private static final char QUOTE = '"';
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final Reader reader;
    private final char delimiter;
    private long recordNumber;
    private int pushback = -2;
    private boolean started;
    private boolean skipBlankLines = true;

    CsvRecordReader(Reader reader, char delimiter) {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid CSV delimiter: '" + delimiter + "'");
        }
        this.reader = reader;
        this.delimiter = delimiter;
    }

    /**
     * Reads the next record.
     *
     * @return the fields of the record, or {@code null} at end of input
     * @throws IOException on read failure or an unterminated quoted field
     */
    List<String> next() throws IOException {
        if (!started) {
            started = true;
            int first = read();
            if (first != BYTE_ORDER_MARK) {
                unread(first);
            }
        }
        while (true) {
            int c = read();
            if (c == -1) {
                return null;
            }
            if (c == '\n' || c == '\r') {
                if (c == '\r') {
                    int n = read();
                    if (n != '\n' && n != -1) {
                        unread(n);
                    }
                }
                if (skipBlankLines) {
                    continue;
                }
                recordNumber++;
                List<String> blank = new ArrayList<>(1);
                blank.add(null);
                return blank;
            }
            unread(c);
            recordNumber++;
            return readRecord();
        }
    }

    /**
     * Controls whether empty lines are skipped. A one-column file needs them as null values.
     *
     * @param skipBlankLines {@code false} to return each empty line as a single null field
     */
    void setSkipBlankLines(boolean skipBlankLines) {
        this.skipBlankLines = skipBlankLines;
    }

    /**
     * @return 1-based number of the last record returned by {@link #next()}, counting the header
     */
    long getRecordNumber() {
        return recordNumber;
    }

    private List<String> readRecord() throws IOException {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean inQuotes = false;

        while (true) {
            int c = read();
            if (inQuotes) {
                if (c == -1) {
                    throw new IOException("Unterminated quoted field in record " + recordNumber);
                }
                if (c == QUOTE) {
                    int n = read();
                    if (n == QUOTE) {
                        field.append(QUOTE);
                    } else {
                        inQuotes = false;
                        if (n != -1) {
                            unread(n);
                        }
                    }
                } else {
                    field.append((char) c);
                }
                continue;
            }

            if (c == -1 || c == '\n' || c == '\r') {
                if (c == '\r') {
                    int n = read();
                    if (n != '\n' && n != -1) {
                        unread(n);
                    }
                }
                fields.add(finish(field, quoted));
                return fields;
            }
            if (c == delimiter) {
                fields.add(finish(field, quoted));
                field.setLength(0);
                quoted = false;
            } else if (c == QUOTE && field.length() == 0 && !quoted) {
                quoted = true;
                inQuotes = true;
            } else {
                field.append((char) c);
            }
        }
    }

    private static String finish(StringBuilder field, boolean quoted) {
        if (!quoted && field.length() == 0) {
            return null;
        }
        return field.toString();
    }

    private int read() throws IOException {
        if (pushback != -2) {
            int c = pushback;
            pushback = -2;
            return c;
        }
        return reader.read();
    }

    private void unread(int c) {
        pushback = c;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
