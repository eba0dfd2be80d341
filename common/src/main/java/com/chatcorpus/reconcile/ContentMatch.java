package com.chatcorpus.reconcile;

import com.chatcorpus.model.Message;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * A content-equivalence pairing found for a primary message without a guid match.
 */
@Data
@AllArgsConstructor
public class ContentMatch {

    private final Message candidate;

    /** In [0, 1]; current matching rules only ever produce 1.0. */
    private final double confidence;

    private final List<String> reasons;
}
