package org.pipesteps.datapipeline.services;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;

import org.pipesteps.datapipeline.api.exceptions.ConfigurationException;
import org.pipesteps.datapipeline.api.steps.IBatchStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Instantiates steps from a HOCON pipeline definition.
 * <p>
 * Each entry of the {@code steps} list has the form:
 * <pre>
 * { name = "filter_data", className = "org.pipesteps.datapipeline.services.steps.FilterStep",
 *   options { column = "feature1", threshold = 10 } }
 * </pre>
 * The class must implement {@link IBatchStep} and expose a public
 * {@code (String name, Config options)} constructor. {@code options} is optional.
 * Any failure is reported as a {@link ConfigurationException} naming the offending entry.
 */
public final class StepFactory {

    private static final Logger log = LoggerFactory.getLogger(StepFactory.class);

    private StepFactory() {
    }

    /**
     * Creates all steps of a definition list, in order.
     *
     * @param stepConfigs step definitions
     * @return the instantiated steps
     * @throws ConfigurationException if an entry is incomplete or cannot be instantiated
     */
    public static List<IBatchStep> createSteps(List<? extends Config> stepConfigs) {
        List<IBatchStep> steps = new ArrayList<>(stepConfigs.size());
        for (int i = 0; i < stepConfigs.size(); i++) {
            steps.add(createStep(stepConfigs.get(i), i));
        }
        return steps;
    }

    /**
     * Creates a single step.
     *
     * @param stepConfig step definition with {@code name}, {@code className} and optional {@code options}
     * @param position index of the entry in the definition list, for error messages
     * @return the instantiated step
     * @throws ConfigurationException if the entry is incomplete or cannot be instantiated
     */
    public static IBatchStep createStep(Config stepConfig, int position) {
        if (!stepConfig.hasPath("name") || !stepConfig.hasPath("className")) {
            throw new ConfigurationException("Step definition #" + position + " requires 'name' and 'className'");
        }
        String name = stepConfig.getString("name");
        String className = stepConfig.getString("className");
        Config options = stepConfig.hasPath("options") ? stepConfig.getConfig("options") : ConfigFactory.empty();

        try {
            Class<?> clazz = Class.forName(className);
            if (!IBatchStep.class.isAssignableFrom(clazz)) {
                throw new ConfigurationException(String.format(
                    "Step '%s': class %s does not implement %s", name, className, IBatchStep.class.getSimpleName()));
            }
            Constructor<?> constructor = clazz.getConstructor(String.class, Config.class);
            IBatchStep step = (IBatchStep) constructor.newInstance(name, options);
            log.debug("Created step '{}' ({})", name, clazz.getSimpleName());
            return step;
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Step '" + name + "': class not found: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new ConfigurationException(String.format(
                "Step '%s': %s has no public (String, Config) constructor", name, className), e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConfigurationException(String.format(
                "Step '%s': invalid options: %s", name, cause.getMessage()), cause);
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Step '" + name + "': cannot instantiate " + className, e);
        }
    }
}
