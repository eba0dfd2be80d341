package com.chatcorpus.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chatcorpus.enrichment.RunOptions;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {

    private static final String YAML = String.join("\n",
            "pipeline:",
            "  mode: ${PIPELINE_MODE:FULL}",
            "input:",
            "  primaryPath: ${EXPORT_DIR}/csv.json",
            "  authoritativePath: ${EXPORT_DIR}/db.json",
            "output:",
            "  path: ${EXPORT_DIR}/messages.enriched.json",
            "  backupExisting: false",
            "enrichment:",
            "  rateLimitDelayMs: 250",
            "  maxRetries: 5",
            "checkpoint:",
            "  dir: ./cp",
            "  interval: 25",
            "  resume: true",
            "incremental:",
            "  enabled: true",
            "  staleAfterDays: 3",
            "forceRefresh: true",
            "enrichers:",
            "  - name: image-analysis",
            "    className: com.example.Images",
            "    asyncTimeoutMs: 45000",
            "    properties:",
            "      apiUrl: http://localhost:8090/images",
            "      timeoutMs: 20000",
            "  - name: link-context",
            "    className: com.example.Links",
            "    enabled: false",
            "unknownSection:",
            "  ignored: true",
            "");

    @Test
    void parsesEverySection() throws Exception {
        PipelineConfig config = PipelineConfig.parse(YAML, new EnvInterpolator(Map.of("EXPORT_DIR", "/data")::get));

        assertEquals(PipelineMode.FULL, config.getMode());
        assertEquals("/data/csv.json", config.getInput().getPrimaryPath());
        assertEquals("/data/db.json", config.getInput().getAuthoritativePath());
        assertFalse(config.getOutput().isBackupExisting());
        assertEquals(250, config.getEnrichment().getRateLimitDelayMs());
        assertEquals(5, config.getEnrichment().getMaxRetries());
        assertEquals(5, config.getEnrichment().getCircuitBreakerThreshold());
        assertEquals(25, config.getCheckpoint().getInterval());
        assertTrue(config.isForceRefresh());

        assertEquals(2, config.getEnrichers().size());
        EnricherConfig images = config.getEnrichers().get(0);
        assertEquals(45_000, images.getAsyncTimeoutMs());
        assertEquals("20000", images.getProperty("timeoutMs"));
        assertEquals(1, config.getEnabledEnrichers().size());
    }

    @Test
    void environmentSelectsTheMode() throws Exception {
        PipelineConfig config = PipelineConfig.parse(YAML,
                new EnvInterpolator(Map.of("EXPORT_DIR", "/data", "PIPELINE_MODE", "MERGE")::get));

        assertEquals(PipelineMode.MERGE, config.getMode());
        assertFalse(config.getMode().enriches());
    }

    @Test
    void emptyDocumentGivesDefaults() throws Exception {
        PipelineConfig config = PipelineConfig.parse("", new EnvInterpolator(name -> null));

        assertEquals(PipelineMode.FULL, config.getMode());
        assertEquals(100, config.getCheckpoint().getInterval());
        assertTrue(config.getEnrichers().isEmpty());
    }

    @Test
    void runOptionsFollowTheConfig() throws Exception {
        PipelineConfig config = PipelineConfig.parse(YAML, new EnvInterpolator(Map.of("EXPORT_DIR", "/data")::get));

        RunOptions options = RunOptions.from(config);

        assertTrue(options.isResume());
        assertTrue(options.isIncremental());
        assertTrue(options.isForceRefresh());
        assertEquals(25, options.getCheckpointInterval());
        assertEquals(Path.of("./cp"), options.getCheckpointDir());
        assertEquals(3, options.getStaleAfterDays());
    }
}
