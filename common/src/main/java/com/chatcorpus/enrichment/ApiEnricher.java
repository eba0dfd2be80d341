package com.chatcorpus.enrichment;

import com.chatcorpus.config.EnricherConfig;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.Message;
import com.chatcorpus.ratelimit.RetryPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * An enricher that POSTs a message to an external REST API and turns the JSON response
 * into an {@link Enrichment}.
 *
 * <p>Supports both synchronous ({@link #enrich}) and asynchronous ({@link #enrichAsync})
 * invocation.  The async path uses {@link HttpClient#sendAsync}; retry delays are
 * scheduled on {@link CompletableFuture#delayedExecutor} so no thread blocks while
 * waiting.  Cancelling the future returned by {@link #enrichAsync} stops the retry chain:
 * the request in flight is cancelled and no further attempt is made.</p>
 *
 * <h3>Mapping</h3>
 * <p>Override {@link #mapToRequest} and {@link #mapFromResponse} in domain-specific
 * subclasses to control exactly what is sent to / received from the API.
 * The defaults send the whole message and keep the whole response.</p>
 *
 * <h3>Retries</h3>
 * <p>{@code 429} and {@code 5xx} responses are retried according to a
 * {@link RetryPolicy}; other non-2xx responses fail immediately.</p>
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code apiUrl} – the HTTP endpoint to POST the request body to</li>
 *   <li>{@code timeoutMs} – per-request HTTP timeout in milliseconds (default: 30000)</li>
 *   <li>{@code maxRetries} – retries after the first attempt; {@link EnricherFactory#createAll}
 *       fills it from {@code enrichment.maxRetries} when unset (default: 3)</li>
 *   <li>{@code apiKeyEnv} – optional environment variable holding the API key</li>
 *   <li>{@code apiKeyHeader} – header carrying the key (default: {@code Authorization},
 *       sent as {@code Bearer <key>})</li>
 *   <li>{@code model} – optional model name reported in the enrichment record</li>
 * </ul>
 */
@Slf4j
public class ApiEnricher implements Enricher {

    private static final String AUTHORIZATION = "Authorization";

    private String name;
    private String apiUrl;
    private int timeoutMs;
    private long asyncTimeoutMs;
    private String apiKeyHeader;
    private String apiKey;
    private String model;
    private RetryPolicy retryPolicy;
    private HttpClient httpClient;
    private ObjectMapper objectMapper;

    @Override
    public void init(EnricherConfig config) {
        this.name = config.getName();
        this.apiUrl = config.getProperty("apiUrl");
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalArgumentException("Enricher '" + name + "' has no apiUrl property");
        }
        this.timeoutMs = Integer.parseInt(config.getProperty("timeoutMs", "30000"));
        this.asyncTimeoutMs = config.getAsyncTimeoutMs();
        this.retryPolicy = new RetryPolicy(Integer.parseInt(
                config.getProperty("maxRetries", String.valueOf(RetryPolicy.DEFAULT_MAX_RETRIES))));
        this.apiKeyHeader = config.getProperty("apiKeyHeader", AUTHORIZATION);
        this.model = config.getProperty("model");

        String apiKeyEnv = config.getProperty("apiKeyEnv");
        if (apiKeyEnv != null) {
            this.apiKey = System.getenv(apiKeyEnv);
            if (apiKey == null) {
                log.warn("Enricher '{}': environment variable {} is not set; calling without a key",
                        name, apiKeyEnv);
            }
        }

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
        this.objectMapper = new ObjectMapper();
        log.info("Initialised {} '{}' → {} (maxRetries: {})",
                getClass().getSimpleName(), name, apiUrl, retryPolicy.getMaxRetries());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getEnrichmentKind() {
        return name;
    }

    @Override
    public boolean supports(Message message) {
        return true;
    }

    @Override
    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    protected String getModel() {
        return model;
    }

    /** Replaces the retry policy, e.g. to inject a seeded one. */
    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    // ── Enrichment ───────────────────────────────────────────────────────

    @Override
    public Enrichment enrich(Message message) throws Exception {
        try {
            return enrichAsync(message).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
    }

    @Override
    public CompletableFuture<Enrichment> enrichAsync(Message message) {
        HttpRequest request;
        try {
            request = buildRequest(message.getGuid(), mapToRequest(message));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Enrichment> result = new CompletableFuture<>();
        sendWithRetry(request, message.getGuid(), 0, result)
                .thenApply(response -> mapFromResponse(message, parseResponseBody(message.getGuid(), response)))
                .whenComplete((enrichment, error) -> {
                    if (error == null) {
                        result.complete(enrichment);
                    } else {
                        result.completeExceptionally(error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error);
                    }
                });
        return result;
    }

    @Override
    public void close() {
        log.info("Closed {} for {}", getClass().getSimpleName(), apiUrl);
    }

    // ──────────────────────── internals ──────────────────────────────────

    /**
     * Sends {@code request}, retrying per the {@link RetryPolicy}.  Once {@code owner} is
     * done (typically cancelled after a timeout) no further attempt is started and the
     * attempt in flight is cancelled.
     */
    private CompletableFuture<HttpResponse<String>> sendWithRetry(HttpRequest request, String guid,
                                                                  int retriesDone, CompletableFuture<?> owner) {
        if (owner.isDone()) {
            log.debug("Enricher '{}' abandoned guid={} before attempt {}", name, guid, retriesDone + 1);
            return CompletableFuture.failedFuture(
                    new CancellationException("Enrichment for guid=" + guid + " was abandoned"));
        }
        CompletableFuture<HttpResponse<String>> attempt =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        owner.whenComplete((ignored, error) -> attempt.cancel(true));
        return attempt.thenCompose(response -> {
                    if (isSuccess(response)) {
                        return CompletableFuture.completedFuture(response);
                    }
                    int nextRetry = retriesDone + 1;
                    RetryPolicy.Decision decision = retryPolicy.decide(response.statusCode(),
                            response.headers().firstValue("Retry-After").orElse(null), nextRetry);
                    if (!decision.isRetry() || !retryPolicy.canRetry(nextRetry)) {
                        return CompletableFuture.failedFuture(failure(guid, response));
                    }
                    log.debug("Enricher '{}' got status={} for guid={}; retry {} in {} ms",
                            name, response.statusCode(), guid, nextRetry, decision.getDelayMs());
                    Executor delayed = CompletableFuture.delayedExecutor(decision.getDelayMs(), TimeUnit.MILLISECONDS);
                    return CompletableFuture.runAsync(() -> { }, delayed)
                            .thenCompose(ignored -> sendWithRetry(request, guid, nextRetry, owner));
                });
    }

    private HttpRequest buildRequest(String guid, Map<String, Object> requestBody) {
        try {
            byte[] body = objectMapper.writeValueAsBytes(requestBody);
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .header("Content-Type", "application/json")
                    .header("X-Message-Guid", guid == null ? "" : guid)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body));
            if (apiKey != null) {
                builder.header(apiKeyHeader, AUTHORIZATION.equalsIgnoreCase(apiKeyHeader) ? "Bearer " + apiKey : apiKey);
            }
            return builder.build();
        } catch (Exception e) {
            throw new EnrichmentException("Failed to build enrichment request for guid=" + guid, e);
        }
    }

    private Map<String, Object> parseResponseBody(String guid, HttpResponse<String> response) {
        try {
            return objectMapper.readValue(response.body(), new TypeReference<>() {});
        } catch (Exception e) {
            throw new EnrichmentException("Failed to parse enrichment response for guid=" + guid,
                    response.statusCode(), e);
        }
    }

    private static boolean isSuccess(HttpResponse<String> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    private EnrichmentException failure(String guid, HttpResponse<String> response) {
        return new EnrichmentException("API enrichment failed for guid=" + guid
                + " status=" + response.statusCode() + " body=" + abbreviate(response.body()),
                response.statusCode(), null);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
