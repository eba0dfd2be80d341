package com.chatcorpus.enrichment;

import com.chatcorpus.config.EnricherConfig;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.Message;
import com.chatcorpus.serde.JsonFiles;
import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Contract for all enrichment implementations.
 *
 * <p>Each enricher receives a message and returns one {@link Enrichment} record of its
 * {@linkplain #getEnrichmentKind() kind}.  Implementations should acquire external
 * resources (HTTP clients, etc.) inside {@link #init(EnricherConfig)}.  The orchestrator
 * treats enrichers as black boxes: it only asks whether a message is
 * {@linkplain #supports(Message) supported} and awaits {@link #enrichAsync(Message)}.</p>
 *
 * <h3>Mapping hooks</h3>
 * <p>Domain-specific enrichers override the mapping methods to transform a message into
 * an API-specific request body, and to interpret API responses back into an enrichment
 * record.  The defaults send the whole message and keep the whole response.</p>
 */
public interface Enricher {

    /** Response keys copied into the enrichment header rather than its fields. */
    Set<String> HEADER_KEYS = Set.of("kind", "provider", "model", "version", "createdAt");

    /**
     * Initialises the enricher with its configuration.
     * Called once before the first message.
     */
    void init(EnricherConfig config);

    /** Configured name, used in logs and in the configuration fingerprint. */
    String getName();

    /** Kind of the enrichment records this enricher produces (e.g. {@code image_analysis}). */
    String getEnrichmentKind();

    /**
     * Whether this enricher can handle {@code message}.  Must not perform I/O.
     */
    boolean supports(Message message);

    /**
     * How long the orchestrator waits for one {@link #enrichAsync} result before
     * recording the message as failed.
     */
    default long getAsyncTimeoutMs() {
        return 30_000;
    }

    // ── Mapping hooks ────────────────────────────────────────────────────

    /**
     * Transforms the message into the body to send to the enrichment API.
     *
     * @param message the message being enriched
     * @return the request body (default: the message as a JSON map)
     */
    default Map<String, Object> mapToRequest(Message message) {
        return JsonFiles.MAPPER.convertValue(message, new TypeReference<Map<String, Object>>() {});
    }

    /**
     * Interprets the enrichment API response as an enrichment record.
     *
     * @param message     the original message
     * @param apiResponse the full API response parsed as a map
     * @return the enrichment to attach (default: every response entry as a field)
     */
    default Enrichment mapFromResponse(Message message, Map<String, Object> apiResponse) {
        Enrichment enrichment = Enrichment.builder()
                .kind(getEnrichmentKind())
                .provider(stringOr(apiResponse.get("provider"), getName()))
                .model(stringOr(apiResponse.get("model"), null))
                .version(stringOr(apiResponse.get("version"), "1.0"))
                .createdAt(Instant.now().toString())
                .fields(new LinkedHashMap<>())
                .build();
        apiResponse.forEach((key, value) -> {
            if (!HEADER_KEYS.contains(key)) {
                enrichment.setField(key, value);
            }
        });
        return enrichment;
    }

    // ── Enrichment ───────────────────────────────────────────────────────

    /**
     * Enriches the given message synchronously.
     *
     * <p>The default implementation of {@link #enrichAsync} delegates to this method.</p>
     *
     * @param message the message to enrich; never modified
     * @return the enrichment record to attach
     */
    Enrichment enrich(Message message) throws Exception;

    /**
     * Async enrichment.  Implementations that perform I/O should override this to use
     * non-blocking clients.
     *
     * <p>Default delegates to the sync {@link #enrich} on the common ForkJoinPool.</p>
     */
    default CompletableFuture<Enrichment> enrichAsync(Message message) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return enrich(message);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        });
    }

    /**
     * Releases resources held by this enricher.
     */
    void close();

    private static String stringOr(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }
}
