package com.chatcorpus.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable snapshot of enrichment progress, keyed by the configuration hash.
 *
 * <p>{@code lastProcessedIndex} is the input index of the last message whose outcome is
 * covered; a resumed run starts at {@code lastProcessedIndex + 1}.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointState implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String CURRENT_VERSION = "1.0";

    private String version;
    private String configHash;
    private int lastProcessedIndex;
    private int totalProcessed;
    private int totalFailed;
    private CheckpointStats stats;
    private List<FailedItem> failedItems;
    private String createdAt;

    @JsonIgnore
    public int getResumeIndex() {
        return lastProcessedIndex + 1;
    }

    public List<FailedItem> getFailedItems() {
        if (failedItems == null) {
            failedItems = new ArrayList<>();
        }
        return failedItems;
    }

    public CheckpointStats getStats() {
        if (stats == null) {
            stats = new CheckpointStats();
        }
        return stats;
    }
}
