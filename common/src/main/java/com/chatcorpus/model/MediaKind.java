package com.chatcorpus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse media classification used to route attachments to enrichers.
 */
public enum MediaKind {
    IMAGE,
    AUDIO,
    VIDEO,
    PDF,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Lenient parse: anything unrecognised maps to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static MediaKind fromWireName(String value) {
        for (MediaKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
