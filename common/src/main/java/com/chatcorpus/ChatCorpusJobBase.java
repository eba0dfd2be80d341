package com.chatcorpus;

import com.chatcorpus.checkpoint.CheckpointMismatchException;
import com.chatcorpus.config.PipelineConfig;
import com.chatcorpus.pipeline.InputUnreadableException;
import com.chatcorpus.pipeline.PipelineOrchestrator;
import com.chatcorpus.pipeline.PipelineReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Abstract base for command-line pipeline jobs.
 *
 * <p>Subclasses only need to provide the default config resource name and
 * the job display name. The pipeline is fully generic and is driven
 * by the YAML configuration.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class MessagesJob extends ChatCorpusJobBase {
 *       protected String getDefaultConfigResource() { return "pipeline-config.yaml"; }
 *       protected String getJobName(PipelineConfig c) { return "Messages [" + c.getMode() + "]"; }
 *       public static void main(String[] args) { System.exit(new MessagesJob().run(args)); }
 *   }
 * </pre>
 */
@Slf4j
public abstract class ChatCorpusJobBase {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    /**
     * Display name used in the start and end log lines.
     */
    protected abstract String getJobName(PipelineConfig config);

    /**
     * Runs the pipeline end-to-end.
     *
     * @param args optional single argument: path to a YAML config file
     * @return the process exit code, see {@link PipelineReport#exitCode()}
     */
    public int run(String[] args) {
        // ── Load configuration ───────────────────────────────────────────
        PipelineConfig config;
        try {
            config = loadConfig(args);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Could not load configuration: {}", e.getMessage(), e);
            return PipelineReport.EXIT_FATAL;
        }

        log.info("Starting {}", getJobName(config));
        log.info("Pipeline mode: {}", config.getMode());
        log.info("Enrichers configured: {}", config.getEnrichers().size());

        // ── Run ──────────────────────────────────────────────────────────
        try {
            PipelineReport report = createOrchestrator(config).run();
            int exitCode = report.exitCode();
            log.info("{} finished with exit code {}", getJobName(config), exitCode);
            return exitCode;
        } catch (InputUnreadableException | CheckpointMismatchException e) {
            log.error("{} aborted: {}", getJobName(config), e.getMessage());
            return PipelineReport.EXIT_FATAL;
        } catch (PipelineException e) {
            log.error("{} failed: {}", getJobName(config), e.getMessage(), e);
            return PipelineReport.EXIT_FATAL;
        }
    }

    protected PipelineOrchestrator createOrchestrator(PipelineConfig config) {
        return new PipelineOrchestrator(config);
    }

    private PipelineConfig loadConfig(String[] args) throws IOException {
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            return PipelineConfig.load(args[0]);
        }
        String resource = getDefaultConfigResource();
        log.info("Loading configuration from classpath: {}", resource);
        return PipelineConfig.loadFromClasspath(resource);
    }
}
