package com.chatcorpus.reconcile;

import com.chatcorpus.model.Message;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Reconciled message list plus the accounting for how it was produced.
 */
@Data
@AllArgsConstructor
public class MergeResult {

    private final List<Message> messages;
    private final MergeStats stats;
}
