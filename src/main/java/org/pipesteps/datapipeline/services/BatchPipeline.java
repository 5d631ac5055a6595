package org.pipesteps.datapipeline.services;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.pipesteps.datapipeline.api.batch.Batch;
import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.exceptions.ConfigurationException;
import org.pipesteps.datapipeline.api.exceptions.FetchException;
import org.pipesteps.datapipeline.api.exceptions.IncompleteFrontierException;
import org.pipesteps.datapipeline.api.exceptions.StepException;
import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.api.steps.IBatchStep;
import org.pipesteps.datapipeline.frontier.Frontier;
import org.pipesteps.datapipeline.frontier.FrontierSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restartable batch pipeline with frontier tracking.
 * <p>
 * Pulls batches from an {@link IBatchFetcher} one at a time, runs each batch through the steps
 * in declared order, persists every step's output as a checkpoint artifact, and only then
 * advances and persists the {@link Frontier}. Batch {@code N+1} is not fetched before batch
 * {@code N}'s frontier is durable, so the persisted frontier always describes a fully committed
 * prefix of batches and a resumed run restarts exactly at the first uncommitted batch.
 * <p>
 * <b>Failure model:</b>
 * <ul>
 *   <li>Fetcher failures surface as {@link FetchException}, step failures as {@link StepException},
 *       storage failures as {@link IOException}. None of them advance the frontier.</li>
 *   <li>Artifacts already written for earlier steps of a failed batch are harmless; they are
 *       overwritten when the batch is recomputed.</li>
 *   <li>There is no automatic retry. Call {@link #run(boolean) run(true)} again after fixing the
 *       cause.</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> This class is <strong>NOT thread-safe</strong>. A pipeline runs in
 * the caller's thread and assumes exclusive ownership of its checkpoint storage; running two
 * pipelines against the same location concurrently is undefined behavior.
 */
public class BatchPipeline {

    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);

    private static final Pattern STEP_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+$");

    private final List<IBatchStep> steps;
    private final List<String> stepNames;
    private final IBatchFetcher fetcher;
    private final int batchSize;
    private final ICheckpointStorage storage;

    private Frontier frontier = new Frontier();
    private PipelineState state = PipelineState.INIT;

    /**
     * Creates a pipeline. Validates the composition without touching the fetcher or storage.
     *
     * @param steps Steps in execution order (at least one, unique names)
     * @param fetcher Source of batches
     * @param batchSize Number of rows requested per batch (must be positive)
     * @param storage Checkpoint storage owned exclusively by this pipeline
     * @throws ConfigurationException if the composition is invalid
     */
    public BatchPipeline(List<? extends IBatchStep> steps, IBatchFetcher fetcher, int batchSize,
                         ICheckpointStorage storage) {
        if (steps == null || steps.isEmpty()) {
            throw new ConfigurationException("A pipeline requires at least one step");
        }
        if (fetcher == null) {
            throw new ConfigurationException("A pipeline requires a batch fetcher");
        }
        if (storage == null) {
            throw new ConfigurationException("A pipeline requires a checkpoint storage");
        }
        if (batchSize <= 0) {
            throw new ConfigurationException("batchSize must be positive: " + batchSize);
        }

        List<String> names = new ArrayList<>(steps.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            IBatchStep step = steps.get(i);
            if (step == null) {
                throw new ConfigurationException("Step #" + i + " is null");
            }
            String name = step.getName();
            if (name == null || !STEP_NAME_PATTERN.matcher(name).matches() || name.equals(".") || name.equals("..")) {
                throw new ConfigurationException(String.format(
                    "Step #%d has an invalid name '%s' (allowed: letters, digits, '_', '-', '.')", i, name));
            }
            if (!seen.add(name)) {
                throw new ConfigurationException("Duplicate step name '" + name + "'; step names must be unique");
            }
            names.add(name);
        }

        this.steps = List.copyOf(steps);
        this.stepNames = Collections.unmodifiableList(names);
        this.fetcher = fetcher;
        this.batchSize = batchSize;
        this.storage = storage;
    }

    /**
     * Processes batches until the fetcher is exhausted.
     *
     * @param resume if true, continue after the persisted frontier; if false, start at batch 0 with
     *               an empty in-memory frontier (persisted artifacts are overwritten as batches
     *               re-commit; call {@link #resetFrontier()} to remove them first)
     * @return summary of the work committed by this call
     * @throws FetchException if the fetcher fails or returns a malformed batch
     * @throws StepException if a step fails or returns a batch at a different position
     * @throws org.pipesteps.datapipeline.api.exceptions.FrontierCorruptionException if the persisted
     *         frontier is unreadable
     * @throws IOException if checkpoint storage fails
     */
    public RunSummary run(boolean resume) throws IOException {
        state = PipelineState.INIT;
        long batchId = 0;
        try {
            if (resume) {
                state = PipelineState.LOAD_FRONTIER;
                frontier = Frontier.load(storage.getFrontierPath());
                checkRecordedSteps(frontier.snapshot());
            } else {
                frontier = new Frontier();
            }

            long startBatchId = frontier.nextBatchId();
            batchId = startBatchId;
            if (resume && startBatchId > 0) {
                log.info("Resuming from frontier: batch {}, row {}", startBatchId, frontier.getLastCompletedRow() + 1);
            } else {
                log.info("Starting batch pipeline: {} steps, batchSize={}", steps.size(), batchSize);
            }

            long batchesCommitted = 0;
            long rowsCommitted = 0;
            while (true) {
                state = PipelineState.FETCHING;
                Optional<Batch> fetched = fetch(batchId);
                if (fetched.isEmpty()) {
                    break;
                }
                Batch input = fetched.get();
                log.debug("Fetched {}", input);

                Batch output = runSteps(input);

                state = PipelineState.ADVANCE_FRONTIER;
                commit(output);
                batchesCommitted++;
                rowsCommitted += output.size();
                log.info("Batch {} committed: {} of {} rows kept, {}", batchId, output.size(), input.size(), frontier);
                batchId++;
            }

            state = PipelineState.DONE;
            log.info("Pipeline complete: {} batches, {} rows committed in this run, {}",
                batchesCommitted, rowsCommitted, frontier);
            return new RunSummary(startBatchId, batchesCommitted, rowsCommitted, frontier.snapshot());
        } catch (IOException | RuntimeException e) {
            state = PipelineState.FAILED;
            log.error("Pipeline failed at batch {}: {}. Frontier remains at {}; a resumed run restarts at batch {}",
                batchId, e.getMessage(), frontier, frontier.nextBatchId());
            throw e;
        }
    }

    /**
     * Reads the last step's artifacts for batches {@code 0..lastCompletedBatchId} and concatenates
     * them in batch order.
     * <p>
     * Uses the in-memory frontier only. A new instance starts with an empty frontier, so over a
     * checkpoint location that already holds commits it fails until {@link #loadFrontier()} or
     * {@link #run(boolean) run(true)} has read the persisted one.
     *
     * @return the combined result of all committed batches
     * @throws IncompleteFrontierException if the in-memory frontier has no committed batch
     * @throws IOException if an artifact is missing, unreadable, or the artifacts' schemas differ
     */
    public Table collectResults() throws IOException {
        if (!frontier.hasCommitted()) {
            throw new IncompleteFrontierException(
                "No batch has been committed yet; run the pipeline (or load its frontier) before collecting results");
        }
        String lastStep = stepNames.get(stepNames.size() - 1);
        long lastBatchId = frontier.getLastCompletedBatchId();

        List<Table> tables = new ArrayList<>();
        for (long id = 0; id <= lastBatchId; id++) {
            tables.add(storage.readArtifact(lastStep, id));
        }
        try {
            Table result = Table.concat(tables);
            log.debug("Collected {} rows from {} artifacts of step '{}'", result.rowCount(), tables.size(), lastStep);
            return result;
        } catch (IllegalArgumentException e) {
            throw new IOException("Checkpoint artifacts of step '" + lastStep + "' are inconsistent: " + e.getMessage(), e);
        }
    }

    /**
     * @return a read-only snapshot of the in-memory frontier
     */
    public FrontierSnapshot getFrontier() {
        return frontier.snapshot();
    }

    /**
     * Replaces the in-memory frontier with the persisted one, e.g. to inspect or collect the
     * results of an earlier process without running the pipeline.
     *
     * @return the loaded frontier
     * @throws org.pipesteps.datapipeline.api.exceptions.FrontierCorruptionException if the record is corrupt
     * @throws IOException if the record cannot be read
     */
    public FrontierSnapshot loadFrontier() throws IOException {
        frontier = Frontier.load(storage.getFrontierPath());
        return frontier.snapshot();
    }

    /**
     * Deletes all checkpoint artifacts and the persisted frontier and empties the in-memory
     * frontier. The next run processes the source from batch 0.
     *
     * @throws IOException if a file cannot be deleted
     */
    public void resetFrontier() throws IOException {
        int deleted = storage.deleteAllArtifacts();
        Files.deleteIfExists(storage.getFrontierPath());
        frontier = new Frontier();
        state = PipelineState.INIT;
        log.info("Frontier reset, {} checkpoint artifacts cleared", deleted);
    }

    public PipelineState getState() {
        return state;
    }

    public List<String> getStepNames() {
        return stepNames;
    }

    public int getBatchSize() {
        return batchSize;
    }

    private Optional<Batch> fetch(long batchId) {
        Optional<Batch> result;
        try {
            result = fetcher.fetch(batchId, batchSize);
        } catch (FetchException e) {
            if (e.getBatchId() == batchId) {
                throw e;
            }
            throw new FetchException(batchId, describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(batchId, "interrupted", e);
        } catch (Exception e) {
            throw new FetchException(batchId, describe(e), e);
        }
        if (result == null) {
            throw new FetchException(batchId, "fetcher returned null instead of an empty Optional");
        }
        if (result.isPresent() && result.get().batchId() != batchId) {
            throw new FetchException(batchId, "fetcher returned batch " + result.get().batchId());
        }
        return result;
    }

    private Batch runSteps(Batch input) throws IOException {
        long batchId = input.batchId();
        Batch current = input;
        for (IBatchStep step : steps) {
            state = PipelineState.RUNNING_STEP;
            String stepName = step.getName();

            Batch output;
            try {
                output = step.process(current);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepException(batchId, stepName, "interrupted", e);
            } catch (Exception e) {
                throw new StepException(batchId, stepName, describe(e), e);
            }
            if (output == null) {
                throw new StepException(batchId, stepName, "step returned null");
            }
            if (output.batchId() != current.batchId() || output.startRow() != current.startRow()) {
                throw new StepException(batchId, stepName, String.format(
                    "step moved the batch from (id=%d, startRow=%d) to (id=%d, startRow=%d)",
                    current.batchId(), current.startRow(), output.batchId(), output.startRow()));
            }

            try {
                storage.writeArtifact(stepName, batchId, output.data());
            } catch (IOException e) {
                throw new IOException(String.format(
                    "Failed to write checkpoint artifact of step '%s' for batch %d: %s", stepName, batchId, e.getMessage()), e);
            }
            log.debug("  {} -> {} rows", stepName, output.size());
            current = output;
        }
        return current;
    }

    private void commit(Batch committed) throws IOException {
        // Advance a copy so the in-memory frontier only moves once the record is durable
        Frontier next = frontier.copy();
        next.advance(committed.batchId(), committed.endRow(), committed.size(), stepNames);
        next.save(storage.getFrontierPath());
        frontier = next;
    }

    private void checkRecordedSteps(FrontierSnapshot snapshot) {
        if (!snapshot.hasCommitted()) {
            return;
        }
        Map<String, Long> recorded = snapshot.stepStates();
        for (String name : stepNames) {
            if (!recorded.containsKey(name)) {
                log.warn("Step '{}' has no recorded progress; batches 0..{} were committed without it",
                    name, snapshot.lastCompletedBatchId());
            }
        }
        for (String name : recorded.keySet()) {
            if (!stepNames.contains(name)) {
                log.warn("Frontier records step '{}' which is not part of this pipeline", name);
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
