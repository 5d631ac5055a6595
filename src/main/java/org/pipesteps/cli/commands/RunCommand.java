package org.pipesteps.cli.commands;

import java.io.File;
import java.io.PrintWriter;

import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.services.BatchPipeline;
import org.pipesteps.datapipeline.services.PipelineFactory;
import org.pipesteps.datapipeline.services.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Runs the configured pipeline. Resumes from the persisted frontier unless {@code --fresh} is given.
 */
@Command(
    name = "run",
    description = "Run the pipeline, resuming after the last committed batch"
)
public class RunCommand extends AbstractPipelineCommand {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"--fresh"},
        description = "Start at batch 0 with an empty frontier (existing artifacts are overwritten)"
    )
    private boolean fresh;

    @Option(
        names = {"-s", "--source"},
        paramLabel = "FILE",
        description = "Override the source file (pipeline.source.options.file)"
    )
    private File sourceFile;

    @Option(
        names = {"-b", "--batch-size"},
        paramLabel = "N",
        description = "Override the batch size (pipeline.batchSize)"
    )
    private Integer batchSize;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = pipelineConfig();
            if (sourceFile != null) {
                config = config.withValue("source.options.file",
                    ConfigValueFactory.fromAnyRef(sourceFile.getAbsolutePath()));
            }
            if (batchSize != null) {
                config = config.withValue("batchSize", ConfigValueFactory.fromAnyRef(batchSize));
            }

            ICheckpointStorage storage = PipelineFactory.createStorage(config);
            try (IBatchFetcher fetcher = PipelineFactory.createFetcher(config)) {
                BatchPipeline pipeline = PipelineFactory.createPipeline(config, fetcher, storage);
                RunSummary summary = pipeline.run(!fresh);

                out.printf("Committed %d batches (%d rows) starting at batch %d%n",
                    summary.batchesCommitted(), summary.rowsCommitted(), summary.startBatchId());
                out.printf("Frontier: last batch %s, last row %d, total rows %d%n",
                    summary.frontier().lastCompletedBatchId(),
                    summary.frontier().lastCompletedRow(),
                    summary.frontier().totalRowsProcessed());
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Run failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
