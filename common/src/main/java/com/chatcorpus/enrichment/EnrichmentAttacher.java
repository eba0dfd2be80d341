package com.chatcorpus.enrichment;

import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.MediaInfo;
import com.chatcorpus.model.Message;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Idempotent attachment of enrichment records, keyed by enrichment kind.
 *
 * <p>Media messages carry their enrichments on {@code media.enrichment}; every other
 * message carries them on the message-level {@code enrichment} list.  A message never
 * ends up with two records of the same kind.</p>
 */
public final class EnrichmentAttacher {

    private EnrichmentAttacher() {
        // utility class
    }

    public static boolean hasEnrichment(Message message, String kind) {
        List<Enrichment> current = enrichmentsOf(message);
        if (current == null) {
            return false;
        }
        for (Enrichment enrichment : current) {
            if (kind.equals(enrichment.getKind())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a copy of {@code message} carrying {@code enrichment}.
     *
     * <p>An existing record of the same kind is kept unless {@code forceRefresh}, in which
     * case the new record takes its position.  The result is deduplicated by kind, keeping
     * the record with the latest {@code createdAt}.</p>
     */
    public static Message attach(Message message, Enrichment enrichment, boolean forceRefresh) {
        Message copy = message.copy();
        List<Enrichment> current = enrichmentsOf(copy);
        List<Enrichment> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);

        int existingIndex = indexOfKind(updated, enrichment.getKind());
        if (existingIndex < 0) {
            updated.add(enrichment);
        } else if (forceRefresh) {
            updated.set(existingIndex, enrichment);
        }

        setEnrichments(copy, deduplicateByKind(updated));
        return copy;
    }

    /**
     * One record per kind, in order of first appearance; among duplicates the latest
     * {@code createdAt} wins, ties keep the earlier record.
     */
    public static List<Enrichment> deduplicateByKind(List<Enrichment> enrichments) {
        Map<String, Enrichment> byKind = new LinkedHashMap<>();
        for (Enrichment enrichment : enrichments) {
            byKind.merge(enrichment.getKind(), enrichment,
                    (kept, candidate) -> isLater(candidate, kept) ? candidate : kept);
        }
        return new ArrayList<>(byKind.values());
    }

    static List<Enrichment> enrichmentsOf(Message message) {
        return message.hasMedia() ? message.getMedia().getEnrichment() : message.getEnrichment();
    }

    static void setEnrichments(Message message, List<Enrichment> enrichments) {
        if (message.hasMedia()) {
            MediaInfo media = message.getMedia();
            media.setEnrichment(enrichments);
        } else {
            message.setEnrichment(enrichments);
        }
    }

    private static int indexOfKind(List<Enrichment> enrichments, String kind) {
        for (int i = 0; i < enrichments.size(); i++) {
            if (kind.equals(enrichments.get(i).getKind())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isLater(Enrichment candidate, Enrichment kept) {
        Instant candidateTime = parse(candidate.getCreatedAt());
        Instant keptTime = parse(kept.getCreatedAt());
        if (candidateTime == null) {
            return false;
        }
        return keptTime == null || candidateTime.isAfter(keptTime);
    }

    private static Instant parse(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
