package com.chatcorpus.pipeline;

import com.chatcorpus.PipelineException;
import com.chatcorpus.config.PipelineConfig;
import com.chatcorpus.config.PipelineMode;
import com.chatcorpus.enrichment.EnricherFactory;
import com.chatcorpus.enrichment.EnrichmentMerger;
import com.chatcorpus.enrichment.EnrichmentOrchestrator;
import com.chatcorpus.enrichment.EnrichmentRunResult;
import com.chatcorpus.enrichment.RunOptions;
import com.chatcorpus.model.ExportEnvelope;
import com.chatcorpus.model.Message;
import com.chatcorpus.reconcile.ContentReconciler;
import com.chatcorpus.reconcile.MergeResult;
import com.chatcorpus.reconcile.MergeStats;
import com.chatcorpus.serde.ExportEnvelopeCodec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the stages selected by the configured {@link PipelineMode}.
 *
 * <p><strong>MERGE mode:</strong>
 * <ul>
 *   <li>Reads the primary (CSV-derived) and authoritative (DB-derived) exports</li>
 *   <li>Reconciles them with the {@link ContentReconciler}</li>
 *   <li>Writes a {@code merged} envelope</li>
 * </ul>
 *
 * <p><strong>ENRICH mode:</strong> enriches the primary export as-is.</p>
 *
 * <p><strong>FULL mode:</strong> reconciles, then enriches the reconciled messages.</p>
 *
 * <p>In incremental mode the enriched messages are merged into the previous output (which
 * is backed up first) so earlier enrichments survive.  The output is always written
 * atomically.  A run that was interrupted writes no output; its checkpoint lets the next
 * run pick up where it stopped.</p>
 */
@Slf4j
public class PipelineOrchestrator {

    private final PipelineConfig config;
    private final ContentReconciler reconciler;
    private final EnrichmentMerger enrichmentMerger;
    private final Supplier<EnrichmentOrchestrator> enrichmentOrchestratorFactory;

    public PipelineOrchestrator(PipelineConfig config) {
        this(config, new ContentReconciler(), new EnrichmentMerger(),
                () -> new EnrichmentOrchestrator(
                        EnricherFactory.createAll(config.getEnrichers(), config.getEnrichment().getMaxRetries()),
                        config.getEnrichment()));
    }

    public PipelineOrchestrator(PipelineConfig config,
                                ContentReconciler reconciler,
                                EnrichmentMerger enrichmentMerger,
                                Supplier<EnrichmentOrchestrator> enrichmentOrchestratorFactory) {
        this.config = config;
        this.reconciler = reconciler;
        this.enrichmentMerger = enrichmentMerger;
        this.enrichmentOrchestratorFactory = enrichmentOrchestratorFactory;
    }

    /**
     * Runs the configured stages end-to-end.
     *
     * @throws InputUnreadableException when an input export cannot be read
     * @throws com.chatcorpus.checkpoint.CheckpointMismatchException when resuming under a different configuration
     * @throws PipelineException when the output cannot be written
     */
    public PipelineReport run() {
        PipelineMode mode = config.getMode();
        Path outputPath = Path.of(config.getOutput().getPath());
        log.info("Running pipeline in {} mode → {}", mode, outputPath);

        PipelineReport.PipelineReportBuilder report = PipelineReport.builder()
                .mode(mode)
                .outputPath(outputPath);

        // ── Reconcile ────────────────────────────────────────────────────
        List<Message> messages;
        String source;
        ExportEnvelope primary = readInput("primary", config.getInput().getPrimaryPath());
        if (mode.reconciles()) {
            ExportEnvelope authoritative = readInput("authoritative", config.getInput().getAuthoritativePath());
            MergeResult merged = reconciler.reconcile(primary.getMessages(), authoritative.getMessages());
            messages = merged.getMessages();
            source = ExportEnvelope.SOURCE_MERGED;
            report.reconciliation(merged.getStats());
        } else {
            messages = primary.getMessages();
            source = primary.getSource() != null ? primary.getSource() : ExportEnvelope.SOURCE_CSV;
        }

        // ── Enrich ───────────────────────────────────────────────────────
        if (mode.enriches()) {
            EnrichmentRunResult enrichment;
            try (EnrichmentOrchestrator orchestrator = enrichmentOrchestratorFactory.get()) {
                enrichment = orchestrator.run(messages, RunOptions.from(config));
            }
            report.enrichment(enrichment);
            if (enrichment.isInterrupted()) {
                log.warn("Enrichment was interrupted; not writing {}. Re-run with checkpoint.resume to continue.",
                        outputPath);
                return report.messageCount(enrichment.getEnriched().size()).outputWritten(false).build();
            }
            messages = enrichment.getEnriched();

            if (config.getIncremental().isEnabled()) {
                ExportEnvelope previous = readPreviousOutput(outputPath);
                if (previous != null) {
                    EnrichmentMerger.Outcome outcome = enrichmentMerger.merge(
                            previous.getMessages(), messages, config.isForceRefresh());
                    messages = outcome.getMessages();
                    report.enrichmentMerge(outcome);
                }
            }
        }

        // ── Write ────────────────────────────────────────────────────────
        PipelineReport partial = report.messageCount(messages.size()).outputWritten(true).build();
        writeOutput(outputPath, ExportEnvelope.of(source, messages, buildMeta(partial)));
        log.info("Wrote {} messages to {}", messages.size(), outputPath);
        return partial;
    }

    // ──────────────────────── internals ──────────────────────────────────

    private ExportEnvelope readInput(String role, String path) {
        if (path == null || path.isBlank()) {
            throw new InputUnreadableException(path, "No " + role + " input path configured");
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new InputUnreadableException(path, "The " + role + " input " + path + " does not exist");
        }
        try {
            ExportEnvelope envelope = ExportEnvelopeCodec.read(file);
            log.info("Read {} {} messages from {}", envelope.getMessages().size(), role, path);
            return envelope;
        } catch (IOException e) {
            throw new InputUnreadableException(path, "The " + role + " input " + path + " is unreadable: "
                    + e.getMessage(), e);
        }
    }

    private ExportEnvelope readPreviousOutput(Path outputPath) {
        if (!Files.isRegularFile(outputPath)) {
            return null;
        }
        try {
            return ExportEnvelopeCodec.read(outputPath);
        } catch (IOException e) {
            log.warn("Previous output {} is unreadable; it will be replaced without merging: {}",
                    outputPath, e.getMessage());
            return null;
        }
    }

    private void writeOutput(Path outputPath, ExportEnvelope envelope) {
        try {
            if (config.getOutput().isBackupExisting()) {
                enrichmentMerger.backup(outputPath);
            }
            ExportEnvelopeCodec.write(outputPath, envelope);
        } catch (IOException e) {
            throw new PipelineException("Failed to write output " + outputPath, e);
        }
    }

    private static Map<String, Object> buildMeta(PipelineReport report) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("mode", report.getMode().name());

        MergeStats stats = report.getReconciliation();
        if (stats != null) {
            Map<String, Object> reconciliation = new LinkedHashMap<>();
            reconciliation.put("csvCount", stats.getCsvCount());
            reconciliation.put("dbCount", stats.getDbCount());
            reconciliation.put("outputCount", stats.getOutputCount());
            reconciliation.put("exactMatches", stats.getExactMatches());
            reconciliation.put("contentMatches", stats.getContentMatches());
            reconciliation.put("noMatches", stats.getNoMatches());
            meta.put("reconciliation", reconciliation);
        }

        EnrichmentRunResult enrichment = report.getEnrichment();
        if (enrichment != null) {
            Map<String, Object> counts = new LinkedHashMap<>();
            counts.put("processed", enrichment.getTotalProcessed());
            counts.put("failed", enrichment.getTotalFailed());
            counts.put("skipped", enrichment.getTotalSkipped());
            counts.put("newMessages", enrichment.getNewMessageCount());
            meta.put("enrichment", counts);
        }
        return meta;
    }
}
