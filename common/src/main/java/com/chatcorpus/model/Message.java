package com.chatcorpus.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single exported message, identified by its {@code guid}.
 *
 * <p>{@link #getMessageKind()} selects which kind-specific payload is meaningful:
 * {@link MediaInfo} for media, {@link TapbackInfo} for tapbacks, {@code text} for text.
 * Dates are ISO-8601 UTC strings exactly as the exporters produced them.</p>
 *
 * <p>Fields the model does not name (e.g. {@code rowid}, {@code groupGuid},
 * {@code threadOriginatorGuid}) are collected in {@link #getExtra()} and written back
 * unchanged, so a read/write cycle never drops input data.</p>
 *
 * <p>Treat instances as immutable once they leave the component that built them;
 * use {@link #copy()} before modifying a message you do not own.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String guid;
    private MessageKind messageKind;
    private String date;
    private String dateRead;
    private String dateDelivered;
    private String dateEdited;
    private String handle;
    private Boolean isFromMe;
    private Boolean isRead;
    private String service;
    private String chatId;
    private String text;
    private MediaInfo media;
    private TapbackInfo tapback;
    private ReplyInfo replyingTo;

    /** Message-level enrichments, used for non-media messages (e.g. link context on text). */
    private List<Enrichment> enrichment;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra;

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra == null ? Map.of() : Collections.unmodifiableMap(extra);
    }

    @JsonAnySetter
    public void setExtra(String name, Object value) {
        if (!(extra instanceof LinkedHashMap)) {
            extra = extra == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extra);
        }
        extra.put(name, value);
    }

    // ── Convenience ──────────────────────────────────────────────────────

    public boolean hasMedia() {
        return messageKind == MessageKind.MEDIA && media != null;
    }

    public boolean hasKind(MessageKind kind) {
        return messageKind == kind;
    }

    /**
     * Deep copy through the JSON tree, so nested payloads and enrichment lists are
     * never shared between the copy and the original.
     */
    public Message copy() {
        try {
            return MAPPER.treeToValue(MAPPER.valueToTree(this), Message.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to copy message guid=" + guid, e);
        }
    }
}
