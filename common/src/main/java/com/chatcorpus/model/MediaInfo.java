package com.chatcorpus.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
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
 * Attachment descriptor carried by {@link MessageKind#MEDIA} messages.
 * Media enrichments are attached here rather than on the message itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MediaInfo implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String filename;
    private String path;
    private Long size;
    private String mimeType;
    private MediaKind mediaKind;
    private List<Enrichment> enrichment;

    /** Fields such as {@code uti}, {@code isSticker} or {@code provenance}, kept verbatim. */
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
}
