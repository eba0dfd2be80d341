package com.chatcorpus.enrichment;

import com.chatcorpus.checkpoint.FailedItem;
import com.chatcorpus.model.Message;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one {@link EnrichmentOrchestrator#run}.
 */
@Value
@Builder
public class EnrichmentRunResult {

    /** Every input message, in input order, enriched where that succeeded. */
    List<Message> enriched;

    int totalProcessed;
    int totalFailed;
    /** Eligible messages passed through because the circuit was open. */
    int totalSkipped;
    List<FailedItem> failedItems;

    /** First index handled by this run; non-zero after a resume. */
    int startIndex;
    /** Size of the delta in incremental mode, otherwise the number of messages. */
    int newMessageCount;

    Path checkpointPath;
    /** Why the final checkpoint could not be written, or {@code null}. */
    String finalCheckpointError;
    /** The calling thread was interrupted and the run stopped early. */
    boolean interrupted;

    public boolean isComplete() {
        return !interrupted && enriched != null && finalCheckpointError == null;
    }
}
