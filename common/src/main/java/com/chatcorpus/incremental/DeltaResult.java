package com.chatcorpus.incremental;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Outcome of comparing the current collection against the previous incremental state.
 */
@Data
@AllArgsConstructor
public class DeltaResult {

    /** Guids not seen by any earlier run, sorted. */
    private final List<String> newGuids;

    private final int totalMessages;
    private final int previousEnrichedCount;
    private final boolean firstRun;

    public int getNewCount() {
        return newGuids.size();
    }

    public double getPercentNew() {
        return totalMessages > 0 ? (getNewCount() * 100.0) / totalMessages : 0.0;
    }
}
