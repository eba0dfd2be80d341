package com.chatcorpus.config;

/**
 * Defines which stages a pipeline run executes.
 */
public enum PipelineMode {

    /**
     * Reconcile the primary and authoritative exports into one envelope; no enrichment.
     */
    MERGE,

    /**
     * Enrich the primary export only.
     */
    ENRICH,

    /**
     * Reconcile, then enrich the reconciled messages.
     */
    FULL;

    public boolean reconciles() {
        return this == MERGE || this == FULL;
    }

    public boolean enriches() {
        return this == ENRICH || this == FULL;
    }
}
