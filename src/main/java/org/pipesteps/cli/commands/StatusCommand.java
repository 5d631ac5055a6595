package org.pipesteps.cli.commands;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;

import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.frontier.FrontierSnapshot;
import org.pipesteps.datapipeline.services.BatchPipeline;
import org.pipesteps.datapipeline.services.PipelineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;

/**
 * Prints the persisted frontier and the checkpoint artifacts of each configured step.
 */
@Command(
    name = "status",
    description = "Show the persisted frontier and checkpoint artifacts"
)
public class StatusCommand extends AbstractPipelineCommand {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = pipelineConfig();
            ICheckpointStorage storage = PipelineFactory.createStorage(config);
            try (IBatchFetcher fetcher = PipelineFactory.createFetcher(config)) {
                BatchPipeline pipeline = PipelineFactory.createPipeline(config, fetcher, storage);
                FrontierSnapshot frontier = pipeline.loadFrontier();

                out.printf("Frontier: %s%n", storage.getFrontierPath());
                if (!frontier.hasCommitted()) {
                    out.println("No batch committed yet; the next run starts at batch 0.");
                } else {
                    out.printf("Last completed batch: %d%n", frontier.lastCompletedBatchId());
                    out.printf("Last completed row:   %d%n", frontier.lastCompletedRow());
                    out.printf("Total rows processed: %d%n", frontier.totalRowsProcessed());
                    out.printf("Next batch:           %d%n", frontier.nextBatchId());
                }

                out.println();
                out.println("Steps:");
                Map<String, Long> stepStates = frontier.stepStates();
                for (String step : pipeline.getStepNames()) {
                    List<Long> artifacts = storage.listArtifactBatchIds(step);
                    Long committed = stepStates.get(step);
                    out.printf("  %-20s committed=%s artifacts=%d%n",
                        step, committed == null ? "-" : committed, artifacts.size());
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Status failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
