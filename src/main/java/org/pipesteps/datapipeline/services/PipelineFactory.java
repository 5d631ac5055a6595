package org.pipesteps.datapipeline.services;

import java.lang.reflect.InvocationTargetException;

import org.pipesteps.datapipeline.api.exceptions.ConfigurationException;
import org.pipesteps.datapipeline.api.fetch.IBatchFetcher;
import org.pipesteps.datapipeline.api.resources.storage.ICheckpointStorage;
import org.pipesteps.datapipeline.resources.storage.FileSystemCheckpointStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Builds the parts of a {@link BatchPipeline} from the {@code pipeline} configuration block:
 * <pre>
 * pipeline {
 *   batchSize = 10
 *   checkpoint { rootDirectory = "/abs/path", compression { ... } }
 *   source { className = "...CsvBatchFetcher", options { file = "input.csv" } }
 *   steps = [ { name = ..., className = ..., options { ... } } ]
 * }
 * </pre>
 * The fetcher is created separately so the caller can close it.
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private PipelineFactory() {
    }

    /**
     * Creates the configured checkpoint storage.
     *
     * @param pipelineConfig the {@code pipeline} block
     * @return the storage
     * @throws ConfigurationException if the block is missing or invalid
     */
    public static ICheckpointStorage createStorage(Config pipelineConfig) {
        if (!pipelineConfig.hasPath("checkpoint")) {
            throw new ConfigurationException("Missing 'pipeline.checkpoint' configuration");
        }
        try {
            return new FileSystemCheckpointStorage("checkpoint", pipelineConfig.getConfig("checkpoint"));
        } catch (IllegalArgumentException | IllegalStateException | ConfigException e) {
            throw new ConfigurationException("Invalid checkpoint configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Creates the configured batch fetcher through its public {@code (String name, Config options)}
     * constructor.
     *
     * @param pipelineConfig the {@code pipeline} block
     * @return the fetcher, owned by the caller
     * @throws ConfigurationException if the source is missing or cannot be instantiated
     */
    public static IBatchFetcher createFetcher(Config pipelineConfig) {
        if (!pipelineConfig.hasPath("source.className")) {
            throw new ConfigurationException("Missing 'pipeline.source.className' configuration");
        }
        Config source = pipelineConfig.getConfig("source");
        String className = source.getString("className");
        Config options = source.hasPath("options") ? source.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> clazz = Class.forName(className);
            if (!IBatchFetcher.class.isAssignableFrom(clazz)) {
                throw new ConfigurationException("Source class " + className + " does not implement "
                    + IBatchFetcher.class.getSimpleName());
            }
            IBatchFetcher fetcher = (IBatchFetcher) clazz.getConstructor(String.class, Config.class)
                .newInstance("source", options);
            log.debug("Created source {}", clazz.getSimpleName());
            return fetcher;
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Source class not found: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new ConfigurationException("Source class " + className + " has no public (String, Config) constructor", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConfigurationException("Invalid source options: " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Cannot instantiate source " + className, e);
        }
    }

    /**
     * Creates the pipeline with its configured steps and batch size.
     *
     * @param pipelineConfig the {@code pipeline} block
     * @param fetcher batch source
     * @param storage checkpoint storage
     * @return the pipeline
     * @throws ConfigurationException if steps or batch size are invalid
     */
    public static BatchPipeline createPipeline(Config pipelineConfig, IBatchFetcher fetcher, ICheckpointStorage storage) {
        if (!pipelineConfig.hasPath("steps")) {
            throw new ConfigurationException("Missing 'pipeline.steps' configuration");
        }
        try {
            int batchSize = pipelineConfig.getInt("batchSize");
            return new BatchPipeline(StepFactory.createSteps(pipelineConfig.getConfigList("steps")),
                fetcher, batchSize, storage);
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }
}
