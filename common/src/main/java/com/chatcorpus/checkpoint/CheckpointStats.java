package com.chatcorpus.checkpoint;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running counters carried inside a checkpoint.
 */
@Data
@NoArgsConstructor
public class CheckpointStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private int processedCount;
    private int failedCount;
    private int skippedCount;
    private Map<String, Integer> enrichmentsByKind = new TreeMap<>();

    public void countEnrichment(String kind) {
        enrichmentsByKind.merge(kind, 1, Integer::sum);
    }

    public CheckpointStats copy() {
        CheckpointStats copy = new CheckpointStats();
        copy.processedCount = processedCount;
        copy.failedCount = failedCount;
        copy.skippedCount = skippedCount;
        copy.enrichmentsByKind = new TreeMap<>(enrichmentsByKind);
        return copy;
    }
}
