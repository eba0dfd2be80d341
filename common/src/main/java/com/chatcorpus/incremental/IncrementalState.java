package com.chatcorpus.incremental;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Snapshot of which messages earlier incremental runs have already seen.
 * One file per logical pipeline, shared across runs.
 */
@Data
@NoArgsConstructor
public class IncrementalState implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CURRENT_VERSION = "1.0";

    private String version = CURRENT_VERSION;
    private String lastEnrichedAt;
    private int totalMessages;
    private List<String> enrichedGuids = new ArrayList<>();
    private PipelineFingerprint pipelineConfig = new PipelineFingerprint();
    private EnrichmentStats enrichmentStats;

    @JsonIgnore
    public Set<String> getEnrichedGuidSet() {
        return new LinkedHashSet<>(enrichedGuids);
    }

    // ── Nested section POJOs ─────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PipelineFingerprint implements Serializable {
        private static final long serialVersionUID = 1L;
        private String configHash;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EnrichmentStats implements Serializable {
        private static final long serialVersionUID = 1L;
        private int processedCount;
        private int failedCount;
        private String startTime;
        private String endTime;
    }
}
