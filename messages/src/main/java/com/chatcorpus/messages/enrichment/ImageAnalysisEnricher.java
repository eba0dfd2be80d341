package com.chatcorpus.messages.enrichment;

import com.chatcorpus.enrichment.ApiEnricher;
import com.chatcorpus.enrichment.EnrichmentException;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.MediaInfo;
import com.chatcorpus.model.MediaKind;
import com.chatcorpus.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes image attachments through a vision model behind an HTTP endpoint.
 *
 * <h3>Request payload</h3>
 * <pre>{@code
 * {
 *   "guid":     "p:0/1234",
 *   "mediaId":  "media:7c1f...",
 *   "path":     "/abs/path/IMG_0001.HEIC",
 *   "filename": "IMG_0001.HEIC",
 *   "mimeType": "image/heic"
 * }
 * }</pre>
 *
 * <h3>Response (example)</h3>
 * <pre>{@code
 * {
 *   "model":            "gemini-1.5-pro",
 *   "visionSummary":    "Two people at a beach at sunset ...",
 *   "shortDescription": "Beach sunset photo"
 * }
 * }</pre>
 *
 * <p>The record is attached to {@code media.enrichment} with kind {@code image_analysis}.</p>
 */
@Slf4j
public class ImageAnalysisEnricher extends ApiEnricher {

    public static final String KIND = "image_analysis";
    private static final String PROVIDER = "gemini";

    @Override
    public String getEnrichmentKind() {
        return KIND;
    }

    @Override
    public boolean supports(Message message) {
        return message.hasMedia() && message.getMedia().getMediaKind() == MediaKind.IMAGE;
    }

    // ── mapToRequest ─────────────────────────────────────────────────────
    //
    //   Only the attachment descriptor is sent; the service reads the file itself.

    @Override
    public Map<String, Object> mapToRequest(Message message) {
        MediaInfo media = message.getMedia();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("guid", message.getGuid());
        request.put("mediaId", media.getId());
        request.put("path", media.getPath());
        request.put("filename", media.getFilename());
        request.put("mimeType", media.getMimeType());
        return request;
    }

    // ── mapFromResponse ──────────────────────────────────────────────────

    @Override
    public Enrichment mapFromResponse(Message message, Map<String, Object> apiResponse) {
        Object visionSummary = apiResponse.get("visionSummary");
        if (visionSummary == null) {
            throw new EnrichmentException("Image analysis response for guid=" + message.getGuid()
                    + " has no visionSummary");
        }

        Enrichment enrichment = Enrichment.builder()
                .kind(KIND)
                .provider(PROVIDER)
                .model(modelFrom(apiResponse))
                .version("1.0")
                .createdAt(Instant.now().toString())
                .build();
        enrichment.setField("visionSummary", visionSummary);
        Object shortDescription = apiResponse.get("shortDescription");
        if (shortDescription != null) {
            enrichment.setField("shortDescription", shortDescription);
        }
        log.debug("mapFromResponse: guid={} → visionSummary of {} chars",
                message.getGuid(), visionSummary.toString().length());
        return enrichment;
    }

    private String modelFrom(Map<String, Object> apiResponse) {
        Object model = apiResponse.get("model");
        return model != null ? model.toString() : getModel();
    }
}
