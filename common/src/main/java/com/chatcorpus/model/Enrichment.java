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
import java.util.Map;

/**
 * One enrichment record attached to a message or to its media.
 *
 * <p>The common header ({@code kind}, {@code provider}, {@code model}, {@code version},
 * {@code createdAt}) is typed; provider-specific output ({@code visionSummary},
 * {@code transcription}, {@code title}, ...) lives in {@link #getFields()} and is written
 * inline next to the header on serialisation.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Enrichment implements Serializable {

    private static final long serialVersionUID = 1L;

    private String kind;
    private String provider;
    private String model;
    private String version;
    private String createdAt;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> fields;

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields == null ? Map.of() : Collections.unmodifiableMap(fields);
    }

    @JsonAnySetter
    public void setField(String name, Object value) {
        if (!(fields instanceof LinkedHashMap)) {
            fields = fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields);
        }
        fields.put(name, value);
    }

    public Object getField(String name) {
        return fields == null ? null : fields.get(name);
    }
}
