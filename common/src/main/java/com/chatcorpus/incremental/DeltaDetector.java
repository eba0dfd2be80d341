package com.chatcorpus.incremental;

import com.chatcorpus.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes which messages are new since the last incremental run.
 *
 * <p>{@link #detectNew} is a pure set difference; {@link #detect} wraps it with the
 * first-run rule (no previous state means every message is new) and logs a summary.</p>
 */
@Slf4j
public class DeltaDetector {

    /**
     * Guids in {@code currentGuids} that {@code previousState} does not record, sorted.
     * A {@code null} state records nothing.
     */
    public List<String> detectNew(Collection<String> currentGuids, IncrementalState previousState) {
        Set<String> seen = previousState == null ? Set.of() : previousState.getEnrichedGuidSet();
        TreeSet<String> fresh = new TreeSet<>();
        for (String guid : currentGuids) {
            if (!seen.contains(guid)) {
                fresh.add(guid);
            }
        }
        return new ArrayList<>(fresh);
    }

    public DeltaResult detect(List<Message> messages, IncrementalState previousState) {
        List<String> currentGuids = new ArrayList<>(messages.size());
        for (Message message : messages) {
            currentGuids.add(message.getGuid());
        }
        List<String> newGuids = detectNew(currentGuids, previousState);
        int previousCount = previousState == null ? 0 : previousState.getEnrichedGuids().size();

        DeltaResult result = new DeltaResult(newGuids, messages.size(), previousCount, previousState == null);
        logSummary(result);
        return result;
    }

    private static void logSummary(DeltaResult result) {
        if (result.isFirstRun()) {
            log.info("First enrichment run: {} messages", result.getTotalMessages());
            return;
        }
        log.info("Delta detected: {} new messages ({}%) of {} total messages",
                result.getNewCount(),
                String.format(Locale.ROOT, "%.1f", result.getPercentNew()),
                result.getTotalMessages());
        log.info("Previously enriched: {}", result.getPreviousEnrichedCount());
    }
}
