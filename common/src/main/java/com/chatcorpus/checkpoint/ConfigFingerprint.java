package com.chatcorpus.checkpoint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * The parts of the enrichment configuration a checkpoint depends on.  Anything that
 * changes which messages get enriched, or how provider calls are paced and retried,
 * belongs here; anything else (paths, intervals) does not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigFingerprint {

    /** Enricher name to enabled flag. */
    private Map<String, Boolean> providers;

    private long rateLimitDelayMs;
    private int maxRetries;
}
