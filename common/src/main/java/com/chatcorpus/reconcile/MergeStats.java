package com.chatcorpus.reconcile;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Counters produced by one {@link ContentReconciler#reconcile} call.
 *
 * <p>{@code csvCount} counts the primary input and {@code dbCount} the authoritative
 * input, after the exporters that usually produce them.</p>
 */
@Data
@NoArgsConstructor
public class MergeStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private int csvCount;
    private int dbCount;
    private int outputCount;
    private int exactMatches;
    private int contentMatches;
    private int noMatches;

    public int getMatchedDbCount() {
        return exactMatches + contentMatches;
    }

    /**
     * Every input message is represented exactly once in the output:
     * matched pairs collapse to one record, everything else passes through.
     */
    public boolean isConsistent() {
        return outputCount == exactMatches + contentMatches + noMatches + (dbCount - getMatchedDbCount())
                && csvCount == exactMatches + contentMatches + noMatches;
    }
}
