package org.arbor.compiler.frontend.processing;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link MultiProcessor} from HOCON configuration.
 *
 * <pre>
 * slots = [
 *   { className = "com.acme.Desugar" }
 *   [ { className = "com.acme.Annotate", options { strict = true } }, "com.acme.Fold" ]
 * ]
 * </pre>
 *
 * <p>Each slot entry is a single processor or a list of processors sharing one traversal.
 * A processor is a class name string or an object with {@code className} and optional
 * {@code options}. Processors need a public no-arg constructor; after instantiation they
 * receive their options layered over {@code arbor.pipeline.processor-defaults}.</p>
 */
public final class PipelineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineFactory.class);

    static final String DEFAULTS_PATH = "arbor.pipeline.processor-defaults";

    private final Config processorDefaults;

    /**
     * Uses the defaults from {@code reference.conf} on the classpath. System properties and
     * environment variables are not consulted.
     */
    public PipelineFactory() {
        this(ConfigFactory.parseResources(PipelineFactory.class.getClassLoader(), "reference.conf").resolve());
    }

    /**
     * @param appConfig Application configuration; must contain {@code arbor.pipeline.processor-defaults}.
     */
    public PipelineFactory(Config appConfig) {
        this.processorDefaults = appConfig.getConfig(DEFAULTS_PATH);
    }

    /**
     * Creates a multi-processor from a pipeline block holding a {@code slots} list.
     *
     * @param pipelineConfig The pipeline configuration.
     * @return A new multi-processor with freshly instantiated processors.
     * @throws IllegalArgumentException if a slot or processor entry is malformed or cannot be instantiated.
     * @throws com.typesafe.config.ConfigException if {@code slots} is missing.
     */
    public MultiProcessor create(Config pipelineConfig) {
        ConfigList slotList = pipelineConfig.getList("slots");
        List<ProcessorSlot> slots = new ArrayList<>();
        for (ConfigValue entry : slotList) {
            List<ParseTreeProcessor> members = new ArrayList<>();
            if (entry instanceof ConfigList memberList) {
                for (ConfigValue member : memberList) {
                    members.add(createProcessor(member));
                }
            } else {
                members.add(createProcessor(entry));
            }
            slots.add(new ProcessorSlot(members));
        }
        LOG.debug("Built pipeline with {} slot(s)", slots.size());
        return new MultiProcessor(slots);
    }

    private ParseTreeProcessor createProcessor(ConfigValue value) {
        switch (value.valueType()) {
            case STRING:
                return instantiate((String) value.unwrapped(), ConfigFactory.empty());
            case OBJECT:
                Config processorConfig = ((ConfigObject) value).toConfig();
                if (!processorConfig.hasPath("className")) {
                    throw new IllegalArgumentException("Processor entry at " + value.origin().description()
                            + " has no className: " + value.render());
                }
                Config options = processorConfig.hasPath("options")
                        ? processorConfig.getConfig("options")
                        : ConfigFactory.empty();
                return instantiate(processorConfig.getString("className"), options);
            default:
                throw new IllegalArgumentException("Unsupported processor entry at "
                        + value.origin().description() + ": " + value.render());
        }
    }

    private ParseTreeProcessor instantiate(String className, Config options) {
        ParseTreeProcessor processor;
        try {
            Class<?> clazz = Class.forName(className);
            if (!ParseTreeProcessor.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException("Class " + className + " does not extend ParseTreeProcessor");
            }
            Constructor<?> constructor = clazz.getConstructor();
            processor = (ParseTreeProcessor) constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate processor: " + className, e);
        }
        processor.initialize(options.withFallback(processorDefaults));
        LOG.debug("Created processor {} (strict={})", className, processor.isStrict());
        return processor;
    }
}
