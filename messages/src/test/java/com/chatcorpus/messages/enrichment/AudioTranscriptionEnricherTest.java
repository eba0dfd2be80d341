package com.chatcorpus.messages.enrichment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chatcorpus.enrichment.EnrichmentException;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.MediaInfo;
import com.chatcorpus.model.MediaKind;
import com.chatcorpus.model.Message;
import com.chatcorpus.model.MessageKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AudioTranscriptionEnricherTest {

    private final AudioTranscriptionEnricher enricher = new AudioTranscriptionEnricher();

    @Test
    void supportsAudioOnly() {
        assertTrue(enricher.supports(voiceMemo()));
        assertFalse(enricher.supports(Message.builder().guid("t").messageKind(MessageKind.TEXT).build()));
    }

    @Test
    void requestIncludesTheFileSize() {
        Map<String, Object> request = enricher.mapToRequest(voiceMemo());

        assertEquals(48_213L, request.get("size"));
        assertEquals("audio/x-m4a", request.get("mimeType"));
    }

    @Test
    void optionalFieldsGetDefaults() {
        Enrichment enrichment = enricher.mapFromResponse(voiceMemo(), Map.of("transcription", "call me back"));

        assertEquals(AudioTranscriptionEnricher.KIND, enrichment.getKind());
        assertEquals("call me back", enrichment.getField("transcription"));
        assertEquals(List.of(), enrichment.getField("speakers"));
        assertEquals(List.of(), enrichment.getField("timestamps"));
        assertEquals(AudioTranscriptionEnricher.DEFAULT_DESCRIPTION, enrichment.getField("shortDescription"));
    }

    @Test
    void responseValuesAreKept() {
        List<Map<String, String>> timestamps = List.of(Map.of("time", "00:01", "speaker", "A", "content", "hey"));
        Enrichment enrichment = enricher.mapFromResponse(voiceMemo(), Map.of(
                "transcription", "hey",
                "model", "gemini-2.0-flash",
                "speakers", List.of("A"),
                "timestamps", timestamps,
                "shortDescription", "Greeting"));

        assertEquals("gemini-2.0-flash", enrichment.getModel());
        assertEquals(List.of("A"), enrichment.getField("speakers"));
        assertEquals(timestamps, enrichment.getField("timestamps"));
        assertEquals("Greeting", enrichment.getField("shortDescription"));
    }

    @Test
    void missingTranscriptionIsRejected() {
        assertThrows(EnrichmentException.class, () -> enricher.mapFromResponse(voiceMemo(), Map.of()));
    }

    private static Message voiceMemo() {
        return Message.builder()
                .guid("p:0/77")
                .messageKind(MessageKind.MEDIA)
                .media(MediaInfo.builder()
                        .id("media:audio-1")
                        .path("/exports/Audio Message.m4a")
                        .mimeType("audio/x-m4a")
                        .size(48_213L)
                        .mediaKind(MediaKind.AUDIO)
                        .build())
                .build();
    }
}
