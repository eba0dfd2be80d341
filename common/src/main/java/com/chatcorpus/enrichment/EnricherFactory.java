package com.chatcorpus.enrichment;

import com.chatcorpus.PipelineException;
import com.chatcorpus.config.EnricherConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates {@link Enricher} instances from configuration using reflection.
 * Keeps the pipeline agnostic to concrete enricher implementations.
 */
@Slf4j
public final class EnricherFactory {

    static final String MAX_RETRIES = "maxRetries";

    private EnricherFactory() {
        // utility class
    }

    /**
     * Loads the configured {@code className}, checks that it is an {@link Enricher},
     * instantiates it through its no-arg constructor and calls {@link Enricher#init}.
     *
     * @throws IllegalArgumentException when the class name is missing or names a non-enricher
     * @throws PipelineException        when the class cannot be loaded or instantiated
     */
    public static Enricher create(EnricherConfig config) {
        String className = config.getClassName();
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("Enricher '" + config.getName() + "' has no className");
        }

        Class<? extends Enricher> type;
        try {
            Class<?> loaded = Class.forName(className);
            if (!Enricher.class.isAssignableFrom(loaded)) {
                throw new IllegalArgumentException(className + " does not implement " + Enricher.class.getName());
            }
            type = loaded.asSubclass(Enricher.class);
        } catch (ClassNotFoundException e) {
            throw new PipelineException("Enricher class not found for '" + config.getName() + "': " + className, e);
        }

        Enricher enricher;
        try {
            enricher = type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new PipelineException("Cannot instantiate enricher '" + config.getName() + "' (" + className
                    + "); it needs a public no-arg constructor", e);
        }
        enricher.init(config);
        log.info("Enricher '{}' ready: {} (kind={})", config.getName(), className, enricher.getEnrichmentKind());
        return enricher;
    }

    /**
     * Creates every enabled enricher, preserving configuration order.
     *
     * @param maxRetries the run-level retry budget, handed to each enricher unless its own
     *                   properties set {@code maxRetries}
     */
    public static List<Enricher> createAll(List<EnricherConfig> configs, int maxRetries) {
        List<Enricher> enrichers = new ArrayList<>();
        for (EnricherConfig config : configs) {
            if (config.isEnabled()) {
                enrichers.add(create(withDefaultMaxRetries(config, maxRetries)));
            } else {
                log.info("Enricher '{}' is disabled; skipping", config.getName());
            }
        }
        return enrichers;
    }

    private static EnricherConfig withDefaultMaxRetries(EnricherConfig config, int maxRetries) {
        EnricherConfig copy = new EnricherConfig();
        copy.setName(config.getName());
        copy.setClassName(config.getClassName());
        copy.setEnabled(config.isEnabled());
        copy.setAsyncTimeoutMs(config.getAsyncTimeoutMs());
        Map<String, String> properties = new HashMap<>(config.getProperties());
        properties.putIfAbsent(MAX_RETRIES, String.valueOf(maxRetries));
        copy.setProperties(properties);
        return copy;
    }
}
