package com.chatcorpus.checkpoint;

import com.chatcorpus.PipelineException;
import lombok.Getter;

/**
 * Raised when a resumed run finds a checkpoint written under a different enrichment
 * configuration.  Fatal: partial results from the old configuration cannot be continued.
 */
@Getter
public class CheckpointMismatchException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final String checkpointHash;
    private final String currentHash;

    public CheckpointMismatchException(String checkpointHash, String currentHash) {
        super("Config mismatch: checkpoint was created with config " + shortHash(checkpointHash)
                + ", but current config is " + shortHash(currentHash)
                + ". Cannot resume with different configuration.");
        this.checkpointHash = checkpointHash;
        this.currentHash = currentHash;
    }

    private static String shortHash(String hash) {
        return hash == null || hash.length() <= 8 ? String.valueOf(hash) : hash.substring(0, 8);
    }
}
