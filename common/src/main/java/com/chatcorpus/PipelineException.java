package com.chatcorpus;

/**
 * Root of the fatal errors that stop a pipeline run.
 *
 * <p>Per-message provider failures are never raised as this type; they are recorded in
 * the run result and the run continues.</p>
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
