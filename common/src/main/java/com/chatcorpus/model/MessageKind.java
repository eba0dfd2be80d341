package com.chatcorpus.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator for the payload a {@link Message} carries.
 */
public enum MessageKind {

    /** Plain text message, payload in {@code text}. */
    TEXT,

    /** Attachment message, payload in {@code media}. */
    MEDIA,

    /** Reaction to another message, payload in {@code tapback}. */
    TAPBACK,

    /** System notification (group rename, participant change, ...). */
    NOTIFICATION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MessageKind fromWireName(String value) {
        for (MessageKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown messageKind: " + value);
    }
}
