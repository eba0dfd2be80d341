package com.chatcorpus.enrichment;

import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.Message;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds a new enrichment pass into a previously written enriched corpus.
 *
 * <p>Messages are matched by guid.  For a matched message the prior enrichment records are
 * kept and only kinds the prior record lacks are appended; with {@code forceRefresh} the new
 * records replace the prior list whenever the new pass produced any.  Messages only present
 * in the new pass are added.  Messages only present in the prior corpus are carried over
 * unchanged at the end.</p>
 */
@Slf4j
public class EnrichmentMerger {

    public static final String BACKUP_SUFFIX = ".backup";

    @Data
    @AllArgsConstructor
    public static class Outcome {
        private final List<Message> messages;
        /** Guids present in both passes. */
        private final int mergedCount;
        /** Guids only in the new pass. */
        private final int addedCount;
        /** Merged messages that kept at least one prior enrichment record. */
        private final int preservedCount;
        /** Guids only in the prior corpus. */
        private final int carriedOverCount;
    }

    public Outcome merge(List<Message> existing, List<Message> fresh, boolean forceRefresh) {
        Map<String, Message> existingByGuid = new LinkedHashMap<>();
        for (Message message : existing) {
            existingByGuid.putIfAbsent(message.getGuid(), message);
        }

        List<Message> result = new ArrayList<>(fresh.size());
        Set<String> seen = new HashSet<>();
        int merged = 0;
        int added = 0;
        int preserved = 0;

        for (Message message : fresh) {
            if (!seen.add(message.getGuid())) {
                continue;
            }
            Message prior = existingByGuid.get(message.getGuid());
            if (prior == null) {
                result.add(message);
                added++;
                continue;
            }
            Message combined = mergeMessage(prior, message, forceRefresh);
            result.add(combined);
            merged++;
            if (keepsAnyOf(combined, prior)) {
                preserved++;
            }
        }

        int carriedOver = 0;
        for (Message prior : existingByGuid.values()) {
            if (!seen.contains(prior.getGuid())) {
                result.add(prior);
                carriedOver++;
            }
        }

        log.info("Enrichment merge: merged={} added={} preserved={} carriedOver={} total={}",
                merged, added, preserved, carriedOver, result.size());
        return new Outcome(result, merged, added, preserved, carriedOver);
    }

    /**
     * Copies {@code output} to {@code <output>.backup}, replacing an older backup.
     *
     * @return the backup path, or {@code null} when there was nothing to back up
     */
    public Path backup(Path output) throws IOException {
        if (!Files.isRegularFile(output)) {
            return null;
        }
        Path backup = output.resolveSibling(output.getFileName() + BACKUP_SUFFIX);
        Files.copy(output, backup, StandardCopyOption.REPLACE_EXISTING);
        log.info("Backed up {} to {}", output, backup);
        return backup;
    }

    // ──────────────────────── internals ──────────────────────────────────

    private Message mergeMessage(Message prior, Message fresh, boolean forceRefresh) {
        List<Enrichment> freshRecords = EnrichmentAttacher.enrichmentsOf(fresh);
        if (freshRecords == null || freshRecords.isEmpty()) {
            return prior;
        }
        Message combined = prior.copy();
        if (forceRefresh) {
            EnrichmentAttacher.setEnrichments(combined, new ArrayList<>(freshRecords));
            return combined;
        }

        List<Enrichment> priorRecords = EnrichmentAttacher.enrichmentsOf(combined);
        List<Enrichment> records = priorRecords == null ? new ArrayList<>() : new ArrayList<>(priorRecords);
        Set<String> kinds = new HashSet<>();
        for (Enrichment record : records) {
            kinds.add(record.getKind());
        }
        for (Enrichment record : freshRecords) {
            if (kinds.add(record.getKind())) {
                records.add(record);
            }
        }
        EnrichmentAttacher.setEnrichments(combined, records);
        return combined;
    }

    private static boolean keepsAnyOf(Message combined, Message prior) {
        List<Enrichment> priorRecords = EnrichmentAttacher.enrichmentsOf(prior);
        List<Enrichment> combinedRecords = EnrichmentAttacher.enrichmentsOf(combined);
        if (priorRecords == null || combinedRecords == null) {
            return false;
        }
        for (Enrichment record : priorRecords) {
            if (combinedRecords.contains(record)) {
                return true;
            }
        }
        return false;
    }
}
