package com.chatcorpus.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * File format shared by every stage: a versioned wrapper around the message list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExportEnvelope implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String SCHEMA_VERSION = "2.0.0";
    public static final String SOURCE_CSV = "csv";
    public static final String SOURCE_DB = "db";
    public static final String SOURCE_MERGED = "merged";

    private String schemaVersion;

    /** csv, db or merged. */
    private String source;

    private String createdAt;
    private List<Message> messages;
    private Map<String, Object> meta;

    public static ExportEnvelope of(String source, List<Message> messages, Map<String, Object> meta) {
        return ExportEnvelope.builder()
                .schemaVersion(SCHEMA_VERSION)
                .source(source)
                .createdAt(Instant.now().toString())
                .messages(new ArrayList<>(messages))
                .meta(meta)
                .build();
    }
}
