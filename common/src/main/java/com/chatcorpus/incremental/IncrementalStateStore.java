package com.chatcorpus.incremental;

import com.chatcorpus.serde.JsonFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads, saves and updates the {@link IncrementalState} file.
 *
 * <p>A missing, unreadable or unknown-version file loads as {@code null}; callers treat
 * that as a first run.  Saves go through {@link JsonFiles#writeAtomically}.</p>
 */
@Slf4j
public class IncrementalStateStore {

    public static final String DEFAULT_STATE_FILE = ".imessage-state.json";
    public static final int DEFAULT_STALE_AFTER_DAYS = 7;

    private final Clock clock;

    public IncrementalStateStore() {
        this(Clock.systemUTC());
    }

    public IncrementalStateStore(Clock clock) {
        this.clock = clock;
    }

    public IncrementalState create(int totalMessages, String configHash) {
        IncrementalState state = new IncrementalState();
        state.setLastEnrichedAt(Instant.now(clock).toString());
        state.setTotalMessages(totalMessages);
        state.getPipelineConfig().setConfigHash(configHash);
        return state;
    }

    public IncrementalState load(Path path) {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            IncrementalState state = JsonFiles.MAPPER.readValue(path.toFile(), IncrementalState.class);
            if (state == null || !IncrementalState.CURRENT_VERSION.equals(state.getVersion())) {
                log.warn("Unknown incremental state version in {}; ignoring it", path);
                return null;
            }
            if (state.getEnrichedGuids() == null) {
                state.setEnrichedGuids(new ArrayList<>());
            }
            return state;
        } catch (IOException e) {
            log.warn("Unreadable incremental state file {}; treating as first run: {}", path, e.getMessage());
            return null;
        }
    }

    public void save(IncrementalState state, Path path) throws IOException {
        JsonFiles.writeAtomically(path, state);
        log.debug("Saved incremental state ({} guids) to {}", state.getEnrichedGuids().size(), path);
    }

    /**
     * Deletes the state file so the next run treats every message as new.
     *
     * @return whether a file was deleted
     */
    public boolean reset(Path path) throws IOException {
        boolean deleted = Files.deleteIfExists(path);
        if (deleted) {
            log.info("Incremental state reset: deleted {}", path);
        }
        return deleted;
    }

    /**
     * Whether the last run is older than {@code daysThreshold} days. Logs a warning
     * suggesting a full re-enrichment when it is.
     */
    public boolean isOutdated(IncrementalState state, int daysThreshold) {
        Instant last;
        try {
            last = Instant.parse(String.valueOf(state.getLastEnrichedAt()));
        } catch (DateTimeParseException e) {
            log.warn("Incremental state has no valid lastEnrichedAt ({}); treating as outdated",
                    state.getLastEnrichedAt());
            return true;
        }
        Duration age = Duration.between(last, Instant.now(clock));
        if (age.compareTo(Duration.ofDays(daysThreshold)) > 0) {
            log.warn("State file is old (ageDays={}, threshold={}). Consider full re-enrichment.",
                    age.toDays(), daysThreshold);
            return true;
        }
        return false;
    }

    /**
     * Folds a finished run into {@code state}: guids are unioned (existing order kept,
     * new guids appended), the timestamp is refreshed and the stats replaced.
     */
    public void recordRun(IncrementalState state, Collection<String> guids,
                          int totalMessages, IncrementalState.EnrichmentStats stats) {
        Set<String> union = new LinkedHashSet<>(state.getEnrichedGuids());
        union.addAll(guids);
        state.setEnrichedGuids(new ArrayList<>(union));
        state.setTotalMessages(totalMessages);
        state.setLastEnrichedAt(Instant.now(clock).toString());
        if (stats != null) {
            state.setEnrichmentStats(stats);
        }
    }
}
