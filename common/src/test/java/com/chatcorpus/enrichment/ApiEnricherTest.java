package com.chatcorpus.enrichment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.chatcorpus.config.EnricherConfig;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.testing.StubHttpServer;
import com.chatcorpus.testing.StubHttpServer.Reply;
import com.chatcorpus.testing.TestMessages;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApiEnricherTest {

    private StubHttpServer server;

    @BeforeEach
    void startServer() throws Exception {
        server = new StubHttpServer();
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void successfulResponseBecomesEnrichmentFields() throws Exception {
        server.reply(Reply.json(200, "{\"model\":\"m-1\",\"summary\":\"hello\"}"));
        ApiEnricher enricher = enricher(Map.of());

        Enrichment enrichment = enricher.enrich(TestMessages.image("g1"));

        assertEquals("summarise", enrichment.getKind());
        assertEquals("summarise", enrichment.getProvider());
        assertEquals("m-1", enrichment.getModel());
        assertEquals("hello", enrichment.getField("summary"));
        assertEquals("g1", server.received().get(0).headers.getFirst("X-Message-Guid"));
        assertTrue(server.received().get(0).body.contains("\"guid\":\"g1\""));
    }

    @Test
    void serverErrorsAreRetriedHonouringRetryAfter() throws Exception {
        server.reply(new Reply(503, "{}", Map.of("Retry-After", "0")))
                .reply(Reply.json(200, "{\"summary\":\"second time\"}"));
        ApiEnricher enricher = enricher(Map.of("maxRetries", "2"));

        Enrichment enrichment = enricher.enrichAsync(TestMessages.image("g1")).get();

        assertEquals("second time", enrichment.getField("summary"));
        assertEquals(2, server.received().size());
    }

    @Test
    void exhaustedRetriesFailWithTheLastStatus() {
        server.reply(new Reply(500, "boom", Map.of("Retry-After", "0")));
        ApiEnricher enricher = enricher(Map.of("maxRetries", "1"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> enricher.enrichAsync(TestMessages.image("g1")).get());

        EnrichmentException cause = (EnrichmentException) e.getCause();
        assertEquals(500, cause.getStatusCode());
        assertEquals(2, server.received().size());
    }

    @Test
    void cancellingAfterATimeoutStopsFurtherRetries() throws Exception {
        server.reply(new Reply(503, "{}", Map.of("Retry-After", "1")));
        ApiEnricher enricher = enricher(Map.of("maxRetries", "3"));

        CompletableFuture<Enrichment> future = enricher.enrichAsync(TestMessages.image("g1"));
        assertThrows(TimeoutException.class, () -> future.get(300, TimeUnit.MILLISECONDS));
        future.cancel(true);

        // the scheduled retry would have fired after one second
        Thread.sleep(1_500);
        assertEquals(1, server.received().size());
        assertTrue(future.isCancelled());
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.reply(Reply.json(400, "{\"error\":\"bad request\"}"));
        ApiEnricher enricher = enricher(Map.of("maxRetries", "3"));

        EnrichmentException e = assertThrows(EnrichmentException.class,
                () -> enricher.enrich(TestMessages.image("g1")));

        assertEquals(400, e.getStatusCode());
        assertEquals(1, server.received().size());
    }

    @Test
    void unparseableBodyIsAFailure() {
        server.reply(Reply.json(200, "not json"));
        ApiEnricher enricher = enricher(Map.of());

        assertThrows(EnrichmentException.class, () -> enricher.enrich(TestMessages.image("g1")));
    }

    @Test
    void apiKeyIsReadFromTheEnvironment() throws Exception {
        String path = System.getenv("PATH");
        assumeTrue(path != null);
        server.reply(Reply.json(200, "{}"));
        ApiEnricher enricher = enricher(Map.of("apiKeyEnv", "PATH", "apiKeyHeader", "X-Api-Key"));

        enricher.enrich(TestMessages.image("g1"));

        assertEquals(path, server.received().get(0).headers.getFirst("X-Api-Key"));
    }

    @Test
    void missingApiUrlIsRejected() {
        EnricherConfig config = new EnricherConfig();
        config.setName("summarise");

        assertThrows(IllegalArgumentException.class, () -> new ApiEnricher().init(config));
    }

    private ApiEnricher enricher(Map<String, String> extra) {
        EnricherConfig config = new EnricherConfig();
        config.setName("summarise");
        Map<String, String> properties = new HashMap<>(extra);
        properties.put("apiUrl", server.url());
        properties.put("timeoutMs", "5000");
        config.setProperties(properties);
        ApiEnricher enricher = new ApiEnricher();
        enricher.init(config);
        return enricher;
    }
}
