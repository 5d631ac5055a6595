package org.pipesteps.datapipeline.frontier;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import org.pipesteps.datapipeline.api.exceptions.FrontierCorruptionException;
import org.pipesteps.datapipeline.utils.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * The durable watermark of a batch pipeline: the most recently fully committed batch and the
 * aggregate counters up to and including it.
 * <p>
 * <b>Commit protocol:</b> {@link #advance} is called exactly once per batch, only after every step
 * has produced and durably stored its checkpoint artifact for that batch, and the frontier is
 * saved before the next batch is fetched. The persisted record therefore always describes a
 * fully committed, contiguous prefix of batches {@code 0..lastCompletedBatchId}.
 * <p>
 * <b>Persistence:</b> A JSON record written with {@link AtomicFiles} (temp file, then atomic
 * rename), so a crash mid-write leaves the previous record intact:
 * <pre>
 * {
 *   "last_completed_batch_id": 2,        // or null before the first commit
 *   "last_completed_row": 29,
 *   "total_rows_processed": 28,
 *   "step_states": { "drop_nulls": 2, "filter_data": 2 }
 * }
 * </pre>
 * <p>
 * <b>Step states:</b> Under the commit protocol every entry equals {@code lastCompletedBatchId}.
 * The map is kept per step so that a record shows which steps a committed batch went through,
 * which matters when the step list of a pipeline changes between runs.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. A frontier has exactly one owner, the pipeline
 * run loop, and is never shared across threads or processes.
 */
public class Frontier {

    private static final Logger log = LoggerFactory.getLogger(Frontier.class);

    static final String KEY_LAST_BATCH_ID = "last_completed_batch_id";
    static final String KEY_LAST_ROW = "last_completed_row";
    static final String KEY_TOTAL_ROWS = "total_rows_processed";
    static final String KEY_STEP_STATES = "step_states";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private Long lastCompletedBatchId;
    private long lastCompletedRow = -1;
    private long totalRowsProcessed;
    private final Map<String, Long> stepStates = new LinkedHashMap<>();

    /**
     * Creates an empty frontier: nothing committed, {@link #nextBatchId()} is 0.
     */
    public Frontier() {
    }

    /**
     * Loads a persisted frontier.
     *
     * @param path location of the frontier record
     * @return the loaded frontier, or a fresh empty one if no record exists
     * @throws FrontierCorruptionException if the record exists but is unparsable or fails validation
     * @throws IOException if the record cannot be read
     */
    public static Frontier load(Path path) throws IOException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.debug("No frontier at {}, starting empty", path);
            return new Frontier();
        }

        JsonElement root;
        try {
            root = JsonParser.parseString(content);
        } catch (JsonParseException e) {
            throw new FrontierCorruptionException(path, "not valid JSON (" + e.getMessage() + ")", e);
        }
        if (root == null || !root.isJsonObject()) {
            throw new FrontierCorruptionException(path, "expected a JSON object");
        }
        JsonObject json = root.getAsJsonObject();

        Frontier frontier = new Frontier();
        JsonElement batchId = require(json, KEY_LAST_BATCH_ID, path);
        frontier.lastCompletedBatchId = batchId.isJsonNull() ? null : readLong(batchId, KEY_LAST_BATCH_ID, 0, path);
        frontier.lastCompletedRow = readLong(require(json, KEY_LAST_ROW, path), KEY_LAST_ROW, -1, path);
        frontier.totalRowsProcessed = readLong(require(json, KEY_TOTAL_ROWS, path), KEY_TOTAL_ROWS, 0, path);

        JsonElement states = require(json, KEY_STEP_STATES, path);
        if (!states.isJsonObject()) {
            throw new FrontierCorruptionException(path, "'" + KEY_STEP_STATES + "' must be an object");
        }
        for (Map.Entry<String, JsonElement> entry : states.getAsJsonObject().entrySet()) {
            String key = KEY_STEP_STATES + "." + entry.getKey();
            long stepBatchId = readLong(entry.getValue(), key, 0, path);
            if (frontier.lastCompletedBatchId == null || stepBatchId > frontier.lastCompletedBatchId) {
                throw new FrontierCorruptionException(path, String.format(
                    "step '%s' is at batch %d, beyond the last committed batch %s",
                    entry.getKey(), stepBatchId, frontier.lastCompletedBatchId));
            }
            frontier.stepStates.put(entry.getKey(), stepBatchId);
        }

        if (frontier.lastCompletedBatchId == null
                && (frontier.totalRowsProcessed != 0 || frontier.lastCompletedRow != -1)) {
            throw new FrontierCorruptionException(path,
                "counters are set but no batch has been committed");
        }

        log.debug("Loaded {} from {}", frontier, path);
        return frontier;
    }

    /**
     * Persists this frontier atomically (temp file, then rename).
     *
     * @param path location of the frontier record
     * @throws IOException if the record cannot be written
     */
    public void save(Path path) throws IOException {
        JsonObject json = new JsonObject();
        json.add(KEY_LAST_BATCH_ID, lastCompletedBatchId == null ? JsonNull.INSTANCE : new JsonPrimitive(lastCompletedBatchId));
        json.addProperty(KEY_LAST_ROW, lastCompletedRow);
        json.addProperty(KEY_TOTAL_ROWS, totalRowsProcessed);
        JsonObject states = new JsonObject();
        stepStates.forEach(states::addProperty);
        json.add(KEY_STEP_STATES, states);

        AtomicFiles.write(path, GSON.toJson(json).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Records a fully committed batch.
     *
     * @param batchId id of the committed batch; must be {@link #nextBatchId()}
     * @param endRow end row of the committed batch (after all steps)
     * @param rowsCommitted number of rows the last step produced for the batch
     * @param stepNames names of all steps the batch went through
     * @throws IllegalStateException if {@code batchId} is not the next id
     * @throws IllegalArgumentException if {@code rowsCommitted} is negative
     */
    public void advance(long batchId, long endRow, long rowsCommitted, Collection<String> stepNames) {
        if (batchId != nextBatchId()) {
            throw new IllegalStateException(String.format(
                "Frontier can only advance to batch %d, not %d", nextBatchId(), batchId));
        }
        if (rowsCommitted < 0) {
            throw new IllegalArgumentException("rowsCommitted must be non-negative: " + rowsCommitted);
        }
        this.lastCompletedBatchId = batchId;
        this.lastCompletedRow = endRow;
        this.totalRowsProcessed += rowsCommitted;
        for (String stepName : stepNames) {
            stepStates.put(stepName, batchId);
        }
    }

    /**
     * @return {@code lastCompletedBatchId + 1}, or 0 if nothing has been committed
     */
    public long nextBatchId() {
        return lastCompletedBatchId == null ? 0 : lastCompletedBatchId + 1;
    }

    public boolean hasCommitted() {
        return lastCompletedBatchId != null;
    }

    public Long getLastCompletedBatchId() {
        return lastCompletedBatchId;
    }

    public long getLastCompletedRow() {
        return lastCompletedRow;
    }

    public long getTotalRowsProcessed() {
        return totalRowsProcessed;
    }

    /**
     * @return an independent mutable copy of this frontier
     */
    public Frontier copy() {
        Frontier copy = new Frontier();
        copy.lastCompletedBatchId = lastCompletedBatchId;
        copy.lastCompletedRow = lastCompletedRow;
        copy.totalRowsProcessed = totalRowsProcessed;
        copy.stepStates.putAll(stepStates);
        return copy;
    }

    /**
     * @return an immutable copy of this frontier
     */
    public FrontierSnapshot snapshot() {
        return new FrontierSnapshot(lastCompletedBatchId, lastCompletedRow, totalRowsProcessed, stepStates);
    }

    private static JsonElement require(JsonObject json, String key, Path path) {
        JsonElement element = json.get(key);
        if (element == null) {
            throw new FrontierCorruptionException(path, "missing field '" + key + "'");
        }
        return element;
    }

    private static long readLong(JsonElement element, String key, long min, Path path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new FrontierCorruptionException(path, "'" + key + "' must be an integer, was " + element);
        }
        long value;
        try {
            value = new BigDecimal(element.getAsString()).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new FrontierCorruptionException(path, "'" + key + "' must be an integer, was " + element, e);
        }
        if (value < min) {
            throw new FrontierCorruptionException(path, "'" + key + "' must be >= " + min + ", was " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "Frontier(batch_id=" + lastCompletedBatchId + ", row=" + lastCompletedRow
            + ", processed=" + totalRowsProcessed + ")";
    }
}
