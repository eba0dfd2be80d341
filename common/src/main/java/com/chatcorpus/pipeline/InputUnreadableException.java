package com.chatcorpus.pipeline;

import com.chatcorpus.PipelineException;
import lombok.Getter;

/**
 * An input export is missing, unreadable or not an export at all.  Fatal.
 */
@Getter
public class InputUnreadableException extends PipelineException {

    private static final long serialVersionUID = 1L;

    /** The configured path, possibly {@code null} when none was configured. */
    private final String path;

    public InputUnreadableException(String path, String message) {
        super(message);
        this.path = path;
    }

    public InputUnreadableException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
