package org.pipesteps.cli.commands;

import java.io.File;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.stream.Collectors;

import org.pipesteps.datapipeline.api.batch.Table;
import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.services.BatchPipeline;
import org.pipesteps.datapipeline.services.PipelineFactory;
import org.pipesteps.datapipeline.services.fetchers.CsvTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Combines the last step's artifacts of all committed batches and prints or exports them.
 */
@Command(
    name = "collect",
    description = "Combine the results of all committed batches"
)
public class CollectCommand extends AbstractPipelineCommand {

    private static final Logger log = LoggerFactory.getLogger(CollectCommand.class);

    @Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "Write the combined result as CSV instead of printing a preview"
    )
    private File outputFile;

    @Option(
        names = {"-n", "--limit"},
        paramLabel = "ROWS",
        defaultValue = "10",
        description = "Rows shown in the preview (default: ${DEFAULT-VALUE})"
    )
    private int limit;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            Config config = pipelineConfig();
            ICheckpointStorage storage = PipelineFactory.createStorage(config);
            try (IBatchFetcher fetcher = PipelineFactory.createFetcher(config)) {
                BatchPipeline pipeline = PipelineFactory.createPipeline(config, fetcher, storage);
                pipeline.loadFrontier();
                Table result = pipeline.collectResults();

                if (outputFile != null) {
                    CsvTableWriter.write(result, outputFile.toPath().toAbsolutePath(), ',');
                    out.printf("Wrote %d rows to %s%n", result.rowCount(), outputFile.getAbsolutePath());
                } else {
                    out.printf("%d rows, columns %s%n", result.rowCount(), result.schema());
                    int shown = Math.min(Math.max(limit, 0), result.rowCount());
                    for (int i = 0; i < shown; i++) {
                        out.println(Arrays.stream(result.row(i))
                            .map(String::valueOf)
                            .collect(Collectors.joining(", ")));
                    }
                    if (shown < result.rowCount()) {
                        out.printf("... %d more rows%n", result.rowCount() - shown);
                    }
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("Collect failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
