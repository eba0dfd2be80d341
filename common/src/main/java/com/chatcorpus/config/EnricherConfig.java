package com.chatcorpus.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for a single enricher instance.
 * Enrichers are tried in configuration order; the first enabled one that supports a
 * message handles it.
 */
@Data
@NoArgsConstructor
public class EnricherConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private String className;
    private Map<String, String> properties = new HashMap<>();

    /** Disabled enrichers are neither instantiated nor part of the config hash's enabled set. */
    private boolean enabled = true;

    /** Upper bound on one enrichment call, retries included (default: 30 seconds). */
    private long asyncTimeoutMs = 30_000;

    public String getProperty(String key) {
        return properties.get(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }
}
