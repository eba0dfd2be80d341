package com.chatcorpus.checkpoint;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * A message whose enrichment failed, recorded with its position in the run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailedItem implements Serializable {

    private static final long serialVersionUID = 1L;

    private int index;
    private String guid;

    /** Enrichment kind that was attempted. */
    private String kind;

    private String error;
}
