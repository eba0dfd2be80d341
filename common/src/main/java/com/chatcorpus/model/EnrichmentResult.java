package com.chatcorpus.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Result produced by a single enricher for a specific message.
 * Contains either the enrichment record (on success) or error details (on failure).
 */
@Data
@NoArgsConstructor
public class EnrichmentResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private String guid;
    private String enricherName;
    private String kind;
    private Enrichment enrichment;
    private boolean success;
    private String errorMessage;
    private long timestamp;

    public static EnrichmentResult success(String guid, String enricherName, Enrichment enrichment) {
        EnrichmentResult result = new EnrichmentResult();
        result.guid = guid;
        result.enricherName = enricherName;
        result.kind = enrichment.getKind();
        result.enrichment = enrichment;
        result.success = true;
        result.timestamp = System.currentTimeMillis();
        return result;
    }

    public static EnrichmentResult failure(String guid, String enricherName, String kind,
                                           String errorMessage) {
        EnrichmentResult result = new EnrichmentResult();
        result.guid = guid;
        result.enricherName = enricherName;
        result.kind = kind;
        result.errorMessage = errorMessage;
        result.success = false;
        result.timestamp = System.currentTimeMillis();
        return result;
    }
}
