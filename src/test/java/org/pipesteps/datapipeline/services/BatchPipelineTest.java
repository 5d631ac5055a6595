package org.pipesteps.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pipesteps.datapipeline.api.batch.Batch;
import org.pipesteps.datapipeline.api.batch.ColumnType;
import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.batch.TableSchema;
import org.pipesteps.datapipeline.api.exceptions.ConfigurationException;
import org.pipesteps.datapipeline.api.exceptions.FetchException;
import org.pipesteps.datapipeline.api.exceptions.FrontierCorruptionException;
import org.pipesteps.datapipeline.api.exceptions.IncompleteFrontierException;
import org.pipesteps.datapipeline.api.exceptions.StepException;
import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.api.steps.IBatchStep;
import org.pipesteps.datapipeline.frontier.Frontier;
import org.pipesteps.datapipeline.frontier.FrontierSnapshot;
import org.pipesteps.datapipeline.resources.storage.FileSystemCheckpointStorage;
import org.pipesteps.datapipeline.services.fetchers.TableBatchFetcher;
import org.pipesteps.datapipeline.services.steps.AddColumnStep;
import org.pipesteps.datapipeline.services.steps.DropNullsStep;
import org.pipesteps.datapipeline.services.steps.FilterStep;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class BatchPipelineTest {

    private static final TableSchema SCHEMA = TableSchema.builder()
        .column("id", ColumnType.BIGINT)
        .column("value", ColumnType.DOUBLE)
        .build();

    private static final int BATCH_SIZE = 10;

    @TempDir
    Path tempDir;

    private FileSystemCheckpointStorage storage;
    private TableBatchFetcher fetcher;

    @BeforeEach
    void setUp() {
        storage = new FileSystemCheckpointStorage("test-checkpoints", ConfigFactory.parseMap(Map.of(
            "rootDirectory", tempDir.toAbsolutePath().toString(),
            "compression.codec", "zstd")));
        fetcher = spy(new TableBatchFetcher(sourceTable(30)));
    }

    private static Table sourceTable(int rows) {
        Table.Builder builder = Table.builder(SCHEMA);
        for (long i = 0; i < rows; i++) {
            builder.addRow(i, (double) i);
        }
        return builder.build();
    }

    /**
     * Removes rows 12 and 15 from batch 1 and optionally fails on that batch.
     */
    static class RemoveFromBatchOneStep implements IBatchStep {
        private final String name;
        boolean failOnBatchOne;
        int calls;

        RemoveFromBatchOneStep(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public Batch process(Batch batch) {
            calls++;
            if (batch.batchId() != 1) {
                return batch;
            }
            if (failOnBatchOne) {
                throw new IllegalStateException("defect in batch 1");
            }
            Set<Long> removed = Set.of(12L, 15L);
            return batch.withData(batch.data().filterRows(row -> !removed.contains((Long) row[0])));
        }
    }

    private BatchPipeline pipeline(IBatchStep... steps) {
        return new BatchPipeline(List.of(steps), fetcher, BATCH_SIZE, storage);
    }

    // ---- Scenarios ----

    @Test
    void run_removesTwoRowsFromBatchOne() throws IOException {
        BatchPipeline pipeline = pipeline(new RemoveFromBatchOneStep("remove"));

        RunSummary summary = pipeline.run(false);

        FrontierSnapshot frontier = pipeline.getFrontier();
        assertThat(frontier.totalRowsProcessed()).isEqualTo(28);
        assertThat(frontier.lastCompletedBatchId()).isEqualTo(2L);
        assertThat(frontier.lastCompletedRow()).isEqualTo(29);
        assertThat(pipeline.collectResults().rowCount()).isEqualTo(28);
        assertThat(summary.batchesCommitted()).isEqualTo(3);
        assertThat(summary.rowsCommitted()).isEqualTo(28);
        assertThat(summary.startBatchId()).isZero();
        assertThat(pipeline.getState()).isEqualTo(PipelineState.DONE);
    }

    @Test
    void run_failureThenResume() throws Exception {
        RemoveFromBatchOneStep step = new RemoveFromBatchOneStep("remove");
        step.failOnBatchOne = true;
        BatchPipeline pipeline = pipeline(step);

        assertThatThrownBy(() -> pipeline.run(false))
            .isInstanceOf(StepException.class)
            .satisfies(e -> {
                StepException stepException = (StepException) e;
                assertThat(stepException.getBatchId()).isEqualTo(1);
                assertThat(stepException.getStepName()).isEqualTo("remove");
                assertThat(stepException).hasRootCauseInstanceOf(IllegalStateException.class);
            });
        assertThat(pipeline.getState()).isEqualTo(PipelineState.FAILED);
        assertThat(pipeline.getFrontier().lastCompletedBatchId()).isEqualTo(0L);
        assertThat(pipeline.getFrontier().totalRowsProcessed()).isEqualTo(10);
        assertThat(Frontier.load(storage.getFrontierPath()).getLastCompletedBatchId()).isEqualTo(0L);

        step.failOnBatchOne = false;
        clearInvocations(fetcher);
        RunSummary summary = pipeline.run(true);

        verify(fetcher, never()).fetch(eq(0L), anyInt());
        verify(fetcher).fetch(1L, BATCH_SIZE);
        verify(fetcher).fetch(2L, BATCH_SIZE);
        assertThat(summary.startBatchId()).isEqualTo(1);
        assertThat(pipeline.getFrontier().lastCompletedBatchId()).isEqualTo(2L);
        assertThat(pipeline.getFrontier().totalRowsProcessed()).isEqualTo(28);
    }

    // ---- Properties ----

    @Test
    void totalRowsEqualsSumOfCommittedBatchSizes() throws IOException {
        BatchPipeline pipeline = pipeline(
            new DropNullsStep("drop_nulls"),
            new AddColumnStep("add_feature1", "value", 3, "feature1"),
            new FilterStep("filter_data", "feature1", 10));

        pipeline.run(false);

        long sum = 0;
        for (long id = 0; id <= pipeline.getFrontier().lastCompletedBatchId(); id++) {
            sum += storage.readArtifact("filter_data", id).rowCount();
        }
        assertThat(pipeline.getFrontier().totalRowsProcessed()).isEqualTo(sum);
        // feature1 = value * 3 > 10 keeps value >= 4
        assertThat(sum).isEqualTo(26);
    }

    @Test
    void resumeAfterExhaustionFetchesOnceAndChangesNothing() throws Exception {
        BatchPipeline pipeline = pipeline(new RemoveFromBatchOneStep("remove"));
        pipeline.run(false);
        FrontierSnapshot before = pipeline.getFrontier();
        String persistedBefore = Files.readString(storage.getFrontierPath());
        clearInvocations(fetcher);

        RunSummary summary = pipeline.run(true);

        verify(fetcher, times(1)).fetch(anyLong(), anyInt());
        verify(fetcher).fetch(3L, BATCH_SIZE);
        assertThat(summary.batchesCommitted()).isZero();
        assertThat(pipeline.getFrontier()).isEqualTo(before);
        assertThat(Files.readString(storage.getFrontierPath())).isEqualTo(persistedBefore);
    }

    @Test
    void newInstanceResumesFromPersistedFrontier() throws Exception {
        RemoveFromBatchOneStep failing = new RemoveFromBatchOneStep("remove");
        failing.failOnBatchOne = true;
        assertThatThrownBy(() -> pipeline(failing).run(false)).isInstanceOf(StepException.class);

        TableBatchFetcher freshFetcher = spy(new TableBatchFetcher(sourceTable(30)));
        BatchPipeline restarted = new BatchPipeline(List.of(new RemoveFromBatchOneStep("remove")),
            freshFetcher, BATCH_SIZE, storage);
        restarted.run(true);

        verify(freshFetcher, never()).fetch(eq(0L), anyInt());
        assertThat(restarted.getFrontier().totalRowsProcessed()).isEqualTo(28);
        assertThat(restarted.collectResults().columnValues("id")).doesNotContain(12L, 15L).hasSize(28);
    }

    @Test
    void duplicateStepNamesRejectedBeforeAnyFetch() {
        IBatchFetcher mockFetcher = mock(IBatchFetcher.class);

        assertThatThrownBy(() -> new BatchPipeline(
                List.of(new DropNullsStep("same"), new DropNullsStep("same")), mockFetcher, BATCH_SIZE, storage))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Duplicate step name 'same'");
        verifyNoInteractions(mockFetcher);
    }

    @Test
    void invalidCompositionsRejected() {
        assertThatThrownBy(() -> new BatchPipeline(List.of(), fetcher, BATCH_SIZE, storage))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pipeline(new DropNullsStep("bad/name")))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> pipeline(new DropNullsStep("..")))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new BatchPipeline(List.of(new DropNullsStep("a")), fetcher, 0, storage))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("batchSize");
        List<IBatchStep> withNull = new ArrayList<>();
        withNull.add(null);
        assertThatThrownBy(() -> new BatchPipeline(withNull, fetcher, BATCH_SIZE, storage))
            .isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(fetcher);
    }

    @Test
    void collectResultsConcatenatesLastStepArtifacts() throws IOException {
        BatchPipeline pipeline = pipeline(
            new RemoveFromBatchOneStep("remove"),
            new AddColumnStep("add_feature1", "value", 3, "feature1"));
        pipeline.run(false);

        Table expected = Table.concat(List.of(
            storage.readArtifact("add_feature1", 0),
            storage.readArtifact("add_feature1", 1),
            storage.readArtifact("add_feature1", 2)));

        Table collected = pipeline.collectResults();
        assertThat(collected).isEqualTo(expected);
        assertThat(collected.schema().columnNames()).containsExactly("id", "value", "feature1");
        assertThat(collected.columnValues("id").get(0)).isEqualTo(0L);
    }

    @Test
    void collectResultsBeforeAnyCommitFails() {
        BatchPipeline pipeline = pipeline(new DropNullsStep("drop_nulls"));

        assertThatThrownBy(pipeline::collectResults).isInstanceOf(IncompleteFrontierException.class);
    }

    @Test
    void collectResultsAfterLoadFrontier() throws IOException {
        pipeline(new RemoveFromBatchOneStep("remove")).run(false);

        BatchPipeline reader = pipeline(new RemoveFromBatchOneStep("remove"));
        assertThatThrownBy(reader::collectResults).isInstanceOf(IncompleteFrontierException.class);
        reader.loadFrontier();

        assertThat(reader.collectResults().rowCount()).isEqualTo(28);
        verify(fetcher, times(4)).fetch(anyLong(), anyInt());
    }

    @Test
    void resetRemovesArtifactsAndFrontier() throws IOException {
        BatchPipeline pipeline = pipeline(new DropNullsStep("drop_nulls"), new FilterStep("filter_data", "value", 5));
        pipeline.run(false);

        pipeline.resetFrontier();

        assertThat(pipeline.getFrontier().nextBatchId()).isZero();
        assertThat(Files.exists(storage.getFrontierPath())).isFalse();
        assertThat(storage.listArtifactBatchIds("drop_nulls")).isEmpty();
        assertThat(storage.listArtifactBatchIds("filter_data")).isEmpty();
        assertThat(pipeline.getState()).isEqualTo(PipelineState.INIT);

        clearInvocations(fetcher);
        pipeline.run(true);
        verify(fetcher).fetch(0L, BATCH_SIZE);
    }

    @Test
    void freshRunRestartsAtZero() throws IOException {
        BatchPipeline pipeline = pipeline(new RemoveFromBatchOneStep("remove"));
        pipeline.run(false);
        clearInvocations(fetcher);

        RunSummary summary = pipeline.run(false);

        verify(fetcher).fetch(0L, BATCH_SIZE);
        assertThat(summary.startBatchId()).isZero();
        assertThat(pipeline.getFrontier().totalRowsProcessed()).isEqualTo(28);
    }

    @Test
    void emptySourceCommitsNothing() throws IOException {
        BatchPipeline pipeline = new BatchPipeline(List.of(new DropNullsStep("drop_nulls")),
            new TableBatchFetcher(Table.empty(SCHEMA)), BATCH_SIZE, storage);

        RunSummary summary = pipeline.run(true);

        assertThat(summary.batchesCommitted()).isZero();
        assertThat(pipeline.getFrontier().hasCommitted()).isFalse();
        assertThat(pipeline.getState()).isEqualTo(PipelineState.DONE);
    }

    @Test
    void stepRemovingAllRowsStillCommitsBatch() throws IOException {
        BatchPipeline pipeline = pipeline(new FilterStep("filter_data", "value", 1000));

        pipeline.run(false);

        assertThat(pipeline.getFrontier().lastCompletedBatchId()).isEqualTo(2L);
        assertThat(pipeline.getFrontier().totalRowsProcessed()).isZero();
        assertThat(pipeline.collectResults().isEmpty()).isTrue();
    }

    // ---- Fetch and step contract violations ----

    @Test
    void fetcherExceptionBecomesFetchException() throws Exception {
        IBatchFetcher failing = mock(IBatchFetcher.class);
        when(failing.fetch(0L, BATCH_SIZE)).thenThrow(new IOException("source offline"));
        BatchPipeline pipeline = new BatchPipeline(List.of(new DropNullsStep("drop_nulls")), failing, BATCH_SIZE, storage);

        assertThatThrownBy(() -> pipeline.run(false))
            .isInstanceOf(FetchException.class)
            .hasMessageContaining("batch 0")
            .hasMessageContaining("source offline")
            .hasCauseInstanceOf(IOException.class);
        assertThat(pipeline.getState()).isEqualTo(PipelineState.FAILED);
        assertThat(pipeline.getFrontier().hasCommitted()).isFalse();
    }

    @Test
    void fetcherReturningNullIsRejected() throws Exception {
        IBatchFetcher broken = mock(IBatchFetcher.class);
        when(broken.fetch(anyLong(), anyInt())).thenReturn(null);
        BatchPipeline pipeline = new BatchPipeline(List.of(new DropNullsStep("drop_nulls")), broken, BATCH_SIZE, storage);

        assertThatThrownBy(() -> pipeline.run(false)).isInstanceOf(FetchException.class);
    }

    @Test
    void fetcherReturningWrongBatchIsRejected() throws Exception {
        IBatchFetcher broken = mock(IBatchFetcher.class);
        when(broken.fetch(anyLong(), anyInt())).thenReturn(Optional.of(Batch.of(7, 70, sourceTable(1))));
        BatchPipeline pipeline = new BatchPipeline(List.of(new DropNullsStep("drop_nulls")), broken, BATCH_SIZE, storage);

        assertThatThrownBy(() -> pipeline.run(false))
            .isInstanceOf(FetchException.class)
            .hasMessageContaining("returned batch 7");
    }

    @Test
    void stepMovingBatchIsRejected() {
        IBatchStep moving = new IBatchStep() {
            @Override
            public String getName() {
                return "moving";
            }

            @Override
            public Batch process(Batch batch) {
                return Batch.of(batch.batchId() + 1, batch.startRow(), batch.data());
            }
        };

        assertThatThrownBy(() -> pipeline(moving).run(false))
            .isInstanceOf(StepException.class)
            .hasMessageContaining("'moving'");
    }

    @Test
    void stepReturningNullIsRejected() {
        IBatchStep nullStep = new IBatchStep() {
            @Override
            public String getName() {
                return "null_step";
            }

            @Override
            public Batch process(Batch batch) {
                return null;
            }
        };

        assertThatThrownBy(() -> pipeline(nullStep).run(false))
            .isInstanceOf(StepException.class)
            .hasMessageContaining("returned null");
    }

    @Test
    void laterStepsNotRunAfterFailure() {
        RemoveFromBatchOneStep failing = new RemoveFromBatchOneStep("first");
        failing.failOnBatchOne = true;
        RemoveFromBatchOneStep second = new RemoveFromBatchOneStep("second");

        assertThatThrownBy(() -> pipeline(failing, second).run(false)).isInstanceOf(StepException.class);

        assertThat(second.calls).isEqualTo(1);
    }

    // ---- Storage ----

    @Test
    void artifactWriteFailureKeepsFrontier() throws Exception {
        ICheckpointStorage failingStorage = mock(ICheckpointStorage.class);
        when(failingStorage.getFrontierPath()).thenReturn(tempDir.resolve("other").resolve("frontier.json"));
        doThrow(new IOException("disk full")).when(failingStorage).writeArtifact(anyString(), eq(1L), any());
        BatchPipeline pipeline = new BatchPipeline(List.of(new DropNullsStep("drop_nulls")), fetcher, BATCH_SIZE, failingStorage);

        assertThatThrownBy(() -> pipeline.run(false))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("drop_nulls")
            .hasMessageContaining("batch 1");

        assertThat(pipeline.getFrontier().lastCompletedBatchId()).isEqualTo(0L);
        verify(fetcher, never()).fetch(eq(2L), anyInt());
    }

    @Test
    void corruptFrontierStopsResumeBeforeFetching() throws Exception {
        Files.writeString(storage.getFrontierPath(), "{ broken");
        BatchPipeline pipeline = pipeline(new DropNullsStep("drop_nulls"));

        assertThatThrownBy(() -> pipeline.run(true)).isInstanceOf(FrontierCorruptionException.class);

        assertThat(pipeline.getState()).isEqualTo(PipelineState.FAILED);
        verifyNoInteractions(fetcher);
    }
}
