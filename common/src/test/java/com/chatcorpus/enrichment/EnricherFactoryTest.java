package com.chatcorpus.enrichment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.chatcorpus.PipelineException;
import com.chatcorpus.config.EnricherConfig;
import com.chatcorpus.testing.StubHttpServer;
import com.chatcorpus.testing.StubHttpServer.Reply;
import com.chatcorpus.testing.TestMessages;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnricherFactoryTest {

    @Test
    void createsAndInitialisesEnabledEnrichersInOrder() {
        EnricherConfig first = config("first", ApiEnricher.class.getName());
        EnricherConfig disabled = config("disabled", ApiEnricher.class.getName());
        disabled.setEnabled(false);
        EnricherConfig second = config("second", ApiEnricher.class.getName());

        List<Enricher> enrichers = EnricherFactory.createAll(List.of(first, disabled, second), 3);

        assertEquals(2, enrichers.size());
        assertInstanceOf(ApiEnricher.class, enrichers.get(0));
        assertEquals("first", enrichers.get(0).getName());
        assertEquals("second", enrichers.get(1).getName());
    }

    @Test
    void runLevelRetryBudgetGovernsEnrichersWithoutTheirOwn() throws Exception {
        try (StubHttpServer server = new StubHttpServer()) {
            server.reply(new Reply(503, "{}", Map.of("Retry-After", "0")));
            EnricherConfig config = config("no-retries", ApiEnricher.class.getName());
            config.setProperties(Map.of("apiUrl", server.url()));

            Enricher enricher = EnricherFactory.createAll(List.of(config), 0).get(0);

            assertThrows(EnrichmentException.class, () -> enricher.enrich(TestMessages.image("g1")));
            assertEquals(1, server.received().size());
            assertFalse(config.getProperties().containsKey("maxRetries"), "caller's config is left as it was");
        }
    }

    @Test
    void enricherRetryPropertyOverridesTheRunLevelBudget() throws Exception {
        try (StubHttpServer server = new StubHttpServer()) {
            server.reply(new Reply(503, "{}", Map.of("Retry-After", "0")));
            EnricherConfig config = config("two-retries", ApiEnricher.class.getName());
            config.setProperties(Map.of("apiUrl", server.url(), "maxRetries", "2"));

            Enricher enricher = EnricherFactory.createAll(List.of(config), 0).get(0);

            assertThrows(EnrichmentException.class, () -> enricher.enrich(TestMessages.image("g1")));
            assertEquals(3, server.received().size());
        }
    }

    @Test
    void unknownClassIsAPipelineError() {
        assertThrows(PipelineException.class,
                () -> EnricherFactory.create(config("ghost", "com.chatcorpus.NoSuchEnricher")));
    }

    @Test
    void classThatIsNotAnEnricherIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EnricherFactory.create(config("string", String.class.getName())));
    }

    private static EnricherConfig config(String name, String className) {
        EnricherConfig config = new EnricherConfig();
        config.setName(name);
        config.setClassName(className);
        config.setProperties(Map.of("apiUrl", "http://127.0.0.1:9/unused"));
        return config;
    }
}
