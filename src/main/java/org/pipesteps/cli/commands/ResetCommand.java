package org.pipesteps.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Files;

import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.services.BatchPipeline;
import org.pipesteps.datapipeline.services.PipelineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Deletes the frontier and all checkpoint artifacts.
 * <p>
 * Default mode is dry-run (preview only), use --force to execute deletion.
 */
@Command(
    name = "reset",
    description = "Delete the frontier and all checkpoint artifacts"
)
public class ResetCommand extends AbstractPipelineCommand {

    private static final Logger log = LoggerFactory.getLogger(ResetCommand.class);

    @Option(
        names = {"--force"},
        description = "Execute deletion (default: dry-run preview only)"
    )
    private boolean force;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = pipelineConfig();
            ICheckpointStorage storage = PipelineFactory.createStorage(config);
            try (IBatchFetcher fetcher = PipelineFactory.createFetcher(config)) {
                BatchPipeline pipeline = PipelineFactory.createPipeline(config, fetcher, storage);

                if (!force) {
                    out.println("=== Reset Preview (dry-run mode, use --force to execute) ===");
                    out.printf("Frontier %s: %s%n", storage.getFrontierPath(),
                        Files.exists(storage.getFrontierPath()) ? "to delete" : "not present");
                    for (String step : pipeline.getStepNames()) {
                        out.printf("  %-20s %d artifacts to delete%n", step, storage.listArtifactBatchIds(step).size());
                    }
                    out.println("\nRun with --force to execute deletion.");
                } else {
                    pipeline.resetFrontier();
                    out.println("Frontier and checkpoint artifacts deleted; the next run starts at batch 0.");
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Reset failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
