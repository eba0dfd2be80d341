package com.chatcorpus.enrichment;

import com.chatcorpus.config.PipelineConfig;
import com.chatcorpus.incremental.IncrementalStateStore;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Per-run switches for {@link EnrichmentOrchestrator#run}.
 */
@Value
@Builder
public class RunOptions {

    boolean resume;
    boolean incremental;
    @Builder.Default
    int checkpointInterval = 100;
    @Builder.Default
    Path checkpointDir = Path.of("./.checkpoints");
    @Builder.Default
    Path stateFile = Path.of("./" + IncrementalStateStore.DEFAULT_STATE_FILE);
    boolean resetState;
    boolean forceRefresh;
    @Builder.Default
    int staleAfterDays = IncrementalStateStore.DEFAULT_STALE_AFTER_DAYS;

    public static RunOptions from(PipelineConfig config) {
        return RunOptions.builder()
                .resume(config.getCheckpoint().isResume())
                .checkpointInterval(config.getCheckpoint().getInterval())
                .checkpointDir(Path.of(config.getCheckpoint().getDir()))
                .incremental(config.getIncremental().isEnabled())
                .stateFile(Path.of(config.getIncremental().getStateFile()))
                .resetState(config.getIncremental().isResetState())
                .staleAfterDays(config.getIncremental().getStaleAfterDays())
                .forceRefresh(config.isForceRefresh())
                .build();
    }
}
