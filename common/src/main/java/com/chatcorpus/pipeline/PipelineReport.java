package com.chatcorpus.pipeline;

import com.chatcorpus.config.PipelineMode;
import com.chatcorpus.enrichment.EnrichmentMerger;
import com.chatcorpus.enrichment.EnrichmentRunResult;
import com.chatcorpus.reconcile.MergeStats;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * What one {@link PipelineOrchestrator#run()} did.  Stage fields are {@code null} when the
 * stage did not run.
 */
@Value
@Builder
public class PipelineReport {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_CHECKPOINT_FAILED = 2;

    PipelineMode mode;
    Path outputPath;
    int messageCount;
    boolean outputWritten;

    MergeStats reconciliation;
    EnrichmentRunResult enrichment;
    EnrichmentMerger.Outcome enrichmentMerge;

    public int exitCode() {
        if (enrichment != null && enrichment.isInterrupted()) {
            return EXIT_FATAL;
        }
        if (enrichment != null && enrichment.getFinalCheckpointError() != null) {
            return EXIT_CHECKPOINT_FAILED;
        }
        return EXIT_OK;
    }
}
