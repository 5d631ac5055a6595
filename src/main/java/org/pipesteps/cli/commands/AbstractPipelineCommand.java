package org.pipesteps.cli.commands;

import java.util.concurrent.Callable;

import org.pipesteps.cli.CommandLineInterface;
import org.pipesteps.datapipeline.api.exceptions.ConfigurationException;

import com.typesafe.config.Config;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Base class of the commands that operate on the configured pipeline.
 */
abstract class AbstractPipelineCommand implements Callable<Integer> {

    @ParentCommand
    protected CommandLineInterface parent;

    @Spec
    protected CommandSpec spec;

    /**
     * @return the {@code pipeline} configuration block
     * @throws ConfigurationException if the block is missing
     */
    protected Config pipelineConfig() {
        Config config = parent.getConfig();
        if (!config.hasPath("pipeline")) {
            throw new ConfigurationException("Missing 'pipeline' configuration block");
        }
        return config.getConfig("pipeline");
    }
}
