package com.chatcorpus.enrichment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.Message;
import com.chatcorpus.testing.TestMessages;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EnrichmentAttacherTest {

    @Test
    void mediaEnrichmentsGoOnTheAttachment() {
        Message image = TestMessages.image("g1");
        Enrichment analysis = TestMessages.enrichment("image_analysis", "2025-01-01T00:00:00Z");

        Message enriched = EnrichmentAttacher.attach(image, analysis, false);

        assertEquals(List.of(analysis), enriched.getMedia().getEnrichment());
        assertNull(enriched.getEnrichment());
        assertTrue(EnrichmentAttacher.hasEnrichment(enriched, "image_analysis"));
        assertFalse(EnrichmentAttacher.hasEnrichment(image, "image_analysis"));
    }

    @Test
    void textEnrichmentsGoOnTheMessage() {
        Message text = TestMessages.text("t1", "alice", "see https://example.com");
        Enrichment link = TestMessages.enrichment("link_context", "2025-01-01T00:00:00Z");

        Message enriched = EnrichmentAttacher.attach(text, link, false);

        assertEquals(List.of(link), enriched.getEnrichment());
    }

    @Test
    void attachingTheSameKindTwiceKeepsTheFirst() {
        Enrichment first = TestMessages.enrichment("image_analysis", "2025-01-01T00:00:00Z");
        Enrichment second = TestMessages.enrichment("image_analysis", "2025-02-01T00:00:00Z");

        Message once = EnrichmentAttacher.attach(TestMessages.image("g1"), first, false);
        Message twice = EnrichmentAttacher.attach(once, second, false);

        assertEquals(List.of(first), twice.getMedia().getEnrichment());
        assertEquals(once, twice);
    }

    @Test
    void forceRefreshReplacesInPlace() {
        Enrichment analysis = TestMessages.enrichment("image_analysis", "2025-01-01T00:00:00Z");
        Enrichment transcription = TestMessages.enrichment("transcription", "2025-01-01T00:00:00Z");
        Enrichment refreshed = TestMessages.enrichment("image_analysis", "2025-03-01T00:00:00Z");
        Message message = EnrichmentAttacher.attach(TestMessages.image("g1"), analysis, false);
        message = EnrichmentAttacher.attach(message, transcription, false);

        Message updated = EnrichmentAttacher.attach(message, refreshed, true);

        assertEquals(List.of(refreshed, transcription), updated.getMedia().getEnrichment());
    }

    @Test
    void duplicatesCollapseToTheLatest() {
        List<Enrichment> records = new ArrayList<>();
        records.add(TestMessages.enrichment("image_analysis", "2025-01-01T00:00:00Z"));
        records.add(TestMessages.enrichment("transcription", "2025-01-05T00:00:00Z"));
        Enrichment latest = TestMessages.enrichment("image_analysis", "2025-04-01T00:00:00Z");
        records.add(latest);
        records.add(TestMessages.enrichment("image_analysis", "not a date"));

        List<Enrichment> deduped = EnrichmentAttacher.deduplicateByKind(records);

        assertEquals(2, deduped.size());
        assertSame(latest, deduped.get(0));
        assertEquals("transcription", deduped.get(1).getKind());
    }

    @Test
    void originalMessageIsNotModified() {
        Message image = TestMessages.image("g1");

        EnrichmentAttacher.attach(image, TestMessages.enrichment("image_analysis", "2025-01-01T00:00:00Z"), false);

        assertNull(image.getMedia().getEnrichment());
    }
}
