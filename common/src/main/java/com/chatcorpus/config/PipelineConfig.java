package com.chatcorpus.config;

import com.chatcorpus.incremental.IncrementalStateStore;
import com.chatcorpus.ratelimit.RateLimiter;
import com.chatcorpus.ratelimit.RetryPolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level pipeline configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * from {@code application.yaml} under the {@code chatcorpus.*} prefix.  The static
 * {@link #load(String)} and {@link #loadFromClasspath(String)} helpers are kept for
 * standalone / test usage outside the Spring context; both expand {@code ${VAR}} and
 * {@code ${VAR:default}} placeholders from the environment before parsing.</p>
 *
 * <pre>
 * pipeline:
 *   mode: FULL
 * input:
 *   primaryPath: ./out/csv.json
 *   authoritativePath: ./out/db.json
 * output:
 *   path: ./out/messages.enriched.json
 * enrichment:
 *   rateLimitDelayMs: 1000
 * checkpoint:
 *   dir: ./.checkpoints
 *   resume: true
 * enrichers:
 *   - name: image-analysis
 *     className: com.chatcorpus.messages.enrichment.ImageAnalysisEnricher
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "chatcorpus")
public class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private PipelineSection pipeline = new PipelineSection();
    private InputSection input = new InputSection();
    private OutputSection output = new OutputSection();
    private EnrichmentSection enrichment = new EnrichmentSection();
    private CheckpointSection checkpoint = new CheckpointSection();
    private IncrementalSection incremental = new IncrementalSection();
    private List<EnricherConfig> enrichers = new ArrayList<>();

    /** Let newly produced enrichments replace existing ones of the same kind. */
    private boolean forceRefresh;

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static PipelineConfig load(String path) throws IOException {
        return parse(Files.readString(Path.of(path), StandardCharsets.UTF_8), new EnvInterpolator());
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8), new EnvInterpolator());
        }
    }

    static PipelineConfig parse(String yaml, EnvInterpolator interpolator) throws IOException {
        if (yaml.isBlank()) {
            return new PipelineConfig();
        }
        PipelineConfig config = YAML_MAPPER.readValue(interpolator.interpolate(yaml), PipelineConfig.class);
        if (config == null) {
            return new PipelineConfig();
        }
        if (config.getEnrichers() == null) {
            config.setEnrichers(new ArrayList<>());
        }
        return config;
    }

    // ── Convenience accessors ────────────────────────────────────────────

    public PipelineMode getMode() {
        return pipeline.getMode();
    }

    public List<EnricherConfig> getEnabledEnrichers() {
        List<EnricherConfig> enabled = new ArrayList<>();
        for (EnricherConfig enricher : enrichers) {
            if (enricher.isEnabled()) {
                enabled.add(enricher);
            }
        }
        return enabled;
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    public static class PipelineSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private PipelineMode mode = PipelineMode.FULL;
    }

    @Data
    public static class InputSection implements Serializable {
        private static final long serialVersionUID = 1L;
        /** CSV-derived export; the side whose non-authoritative fields are kept. */
        private String primaryPath;
        /** DB-derived export; wins for timestamps, handle, read state and reply targets. */
        private String authoritativePath;
    }

    @Data
    public static class OutputSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private String path = "./messages.enriched.json";
        /** Copy an existing output file to {@code <path>.backup} before replacing it. */
        private boolean backupExisting = true;
    }

    @Data
    public static class EnrichmentSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private long rateLimitDelayMs = RateLimiter.DEFAULT_DELAY_MS;
        private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
        private int circuitBreakerThreshold = RateLimiter.DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
        private long circuitBreakerResetMs = RateLimiter.DEFAULT_CIRCUIT_BREAKER_RESET_MS;
    }

    @Data
    public static class CheckpointSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private String dir = "./.checkpoints";
        private int interval = 100;
        private boolean resume;
    }

    @Data
    public static class IncrementalSection implements Serializable {
        private static final long serialVersionUID = 1L;
        private boolean enabled;
        private String stateFile = "./" + IncrementalStateStore.DEFAULT_STATE_FILE;
        private boolean resetState;
        private int staleAfterDays = IncrementalStateStore.DEFAULT_STALE_AFTER_DAYS;
    }
}
