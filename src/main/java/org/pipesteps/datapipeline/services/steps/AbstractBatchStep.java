package org.pipesteps.datapipeline.services.steps;

import org.pipesteps.datapipeline.api.steps.IBatchStep;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Base class for the built-in steps.
 * <p>
 * Holds the step name and its HOCON options. Every subclass provides a public
 * {@code (String name, Config options)} constructor so that {@link StepFactory} can create it
 * from a pipeline definition:
 * <pre>
 * steps = [
 *   { name = "drop_nulls", className = "org.pipesteps.datapipeline.services.steps.DropNullsStep" }
 *   { name = "add_feature1", className = "org.pipesteps.datapipeline.services.steps.AddColumnStep"
 *     options { sourceColumn = "value", multiplier = 3, newColumn = "feature1" } }
 * ]
 * </pre>
 * Subclasses must keep {@link #process} free of side effects (see {@link IBatchStep}).
 */
public abstract class AbstractBatchStep implements IBatchStep {

    protected final String name;
    protected final Config options;

    /**
     * @param name Step name (must not be null/blank)
     * @param options Step options (null is treated as empty)
     */
    protected AbstractBatchStep(String name, Config options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name must not be null or blank");
        }
        this.name = name;
        this.options = options != null ? options : ConfigFactory.empty();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
