package com.chatcorpus.messages.enrichment;

import com.chatcorpus.enrichment.ApiEnricher;
import com.chatcorpus.enrichment.EnrichmentException;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.MediaInfo;
import com.chatcorpus.model.MediaKind;
import com.chatcorpus.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transcribes audio attachments (voice memos) through a speech model behind an HTTP
 * endpoint.
 *
 * <p>The response must carry {@code transcription}; {@code speakers}, {@code timestamps}
 * ({@code [{time, speaker, content}]}) and {@code shortDescription} are optional.  The
 * record is attached to {@code media.enrichment} with kind {@code transcription}.</p>
 */
@Slf4j
public class AudioTranscriptionEnricher extends ApiEnricher {

    public static final String KIND = "transcription";
    static final String DEFAULT_DESCRIPTION = "Audio transcription available";
    private static final String PROVIDER = "gemini";

    @Override
    public String getEnrichmentKind() {
        return KIND;
    }

    @Override
    public boolean supports(Message message) {
        return message.hasMedia() && message.getMedia().getMediaKind() == MediaKind.AUDIO;
    }

    @Override
    public Map<String, Object> mapToRequest(Message message) {
        MediaInfo media = message.getMedia();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("guid", message.getGuid());
        request.put("mediaId", media.getId());
        request.put("path", media.getPath());
        request.put("mimeType", media.getMimeType());
        request.put("size", media.getSize());
        return request;
    }

    @Override
    public Enrichment mapFromResponse(Message message, Map<String, Object> apiResponse) {
        Object transcription = apiResponse.get("transcription");
        if (transcription == null) {
            throw new EnrichmentException("Transcription response for guid=" + message.getGuid()
                    + " has no transcription");
        }

        Enrichment enrichment = Enrichment.builder()
                .kind(KIND)
                .provider(PROVIDER)
                .model(apiResponse.get("model") != null ? apiResponse.get("model").toString() : getModel())
                .version("1.0")
                .createdAt(Instant.now().toString())
                .build();
        enrichment.setField("transcription", transcription);
        enrichment.setField("speakers", listOrEmpty(apiResponse.get("speakers")));
        enrichment.setField("timestamps", listOrEmpty(apiResponse.get("timestamps")));

        Object shortDescription = apiResponse.get("shortDescription");
        enrichment.setField("shortDescription", shortDescription != null ? shortDescription : DEFAULT_DESCRIPTION);
        return enrichment;
    }

    private static List<?> listOrEmpty(Object value) {
        return value instanceof List ? (List<?>) value : new ArrayList<>();
    }
}
