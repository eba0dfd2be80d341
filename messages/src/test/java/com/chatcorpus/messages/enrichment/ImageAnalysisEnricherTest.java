package com.chatcorpus.messages.enrichment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chatcorpus.config.EnricherConfig;
import com.chatcorpus.enrichment.EnrichmentException;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.MediaInfo;
import com.chatcorpus.model.MediaKind;
import com.chatcorpus.model.Message;
import com.chatcorpus.model.MessageKind;
import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ImageAnalysisEnricherTest {

    private static final Message PHOTO = Message.builder()
            .guid("p:0/1234")
            .messageKind(MessageKind.MEDIA)
            .handle("+15550001111")
            .media(MediaInfo.builder()
                    .id("media:7c1f")
                    .filename("IMG_0001.HEIC")
                    .path("/exports/IMG_0001.HEIC")
                    .mimeType("image/heic")
                    .mediaKind(MediaKind.IMAGE)
                    .build())
            .build();

    @Test
    void supportsOnlyImageAttachments() {
        ImageAnalysisEnricher enricher = new ImageAnalysisEnricher();
        Message audio = PHOTO.toBuilder()
                .media(MediaInfo.builder().id("media:a1").mediaKind(MediaKind.AUDIO).build())
                .build();
        Message text = Message.builder().guid("t").messageKind(MessageKind.TEXT).text("hi").build();

        assertTrue(enricher.supports(PHOTO));
        assertFalse(enricher.supports(audio));
        assertFalse(enricher.supports(text));
    }

    @Test
    void requestCarriesTheAttachmentDescriptor() {
        Map<String, Object> request = new ImageAnalysisEnricher().mapToRequest(PHOTO);

        assertEquals("p:0/1234", request.get("guid"));
        assertEquals("media:7c1f", request.get("mediaId"));
        assertEquals("/exports/IMG_0001.HEIC", request.get("path"));
        assertEquals("image/heic", request.get("mimeType"));
    }

    @Test
    void responseWithoutVisionSummaryIsRejected() {
        ImageAnalysisEnricher enricher = new ImageAnalysisEnricher();

        assertThrows(EnrichmentException.class, () -> enricher.mapFromResponse(PHOTO, Map.of("model", "x")));
    }

    @Test
    void analysesAnImageOverHttp() throws Exception {
        AtomicReference<String> requestBody = new AtomicReference<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/analyze-image", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = "{\"visionSummary\":\"Two people at a beach\",\"shortDescription\":\"Beach photo\"}"
                    .getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        try {
            ImageAnalysisEnricher enricher = new ImageAnalysisEnricher();
            enricher.init(config("http://127.0.0.1:" + server.getAddress().getPort() + "/analyze-image"));

            Enrichment enrichment = enricher.enrich(PHOTO);

            assertEquals(ImageAnalysisEnricher.KIND, enrichment.getKind());
            assertEquals("gemini", enrichment.getProvider());
            assertEquals("gemini-1.5-pro", enrichment.getModel());
            assertEquals("Two people at a beach", enrichment.getField("visionSummary"));
            assertEquals("Beach photo", enrichment.getField("shortDescription"));
            assertTrue(requestBody.get().contains("\"filename\":\"IMG_0001.HEIC\""));
        } finally {
            server.stop(0);
        }
    }

    private static EnricherConfig config(String url) {
        EnricherConfig config = new EnricherConfig();
        config.setName("image-analysis");
        Map<String, String> properties = new HashMap<>();
        properties.put("apiUrl", url);
        properties.put("model", "gemini-1.5-pro");
        properties.put("maxRetries", "0");
        config.setProperties(properties);
        return config;
    }
}
