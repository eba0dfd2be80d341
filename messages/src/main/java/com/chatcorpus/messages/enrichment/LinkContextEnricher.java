package com.chatcorpus.messages.enrichment;

import com.chatcorpus.enrichment.ApiEnricher;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.Message;
import com.chatcorpus.model.MessageKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches context (title, summary) for the first link found in a text message.
 *
 * <p>The link's site decides the provider tag recorded on the enrichment:
 * {@code youtube}, {@code spotify}, {@code twitter} (also {@code x.com}),
 * {@code instagram}, or {@code generic} for everything else.  The record is attached to
 * the message-level {@code enrichment} list with kind {@code link_context}.</p>
 */
@Slf4j
public class LinkContextEnricher extends ApiEnricher {

    public static final String KIND = "link_context";
    static final String GENERIC_PROVIDER = "generic";

    private static final Pattern URL = Pattern.compile("https?://[^\\s)]+");

    /** Checked in order; the first match names the provider. */
    private static final Map<String, Pattern> PROVIDER_PATTERNS = new LinkedHashMap<>();

    static {
        PROVIDER_PATTERNS.put("youtube", Pattern.compile(
                "^https?://(www\\.)?(youtube\\.com|youtu\\.be|youtube-nocookie\\.com)", Pattern.CASE_INSENSITIVE));
        PROVIDER_PATTERNS.put("spotify", Pattern.compile(
                "^https?://open\\.spotify\\.com/(track|album|playlist|artist)", Pattern.CASE_INSENSITIVE));
        PROVIDER_PATTERNS.put("twitter", Pattern.compile(
                "^https?://(www\\.)?(twitter\\.com|x\\.com)", Pattern.CASE_INSENSITIVE));
        PROVIDER_PATTERNS.put("instagram", Pattern.compile(
                "^https?://(www\\.)?instagram\\.com", Pattern.CASE_INSENSITIVE));
    }

    @Override
    public String getEnrichmentKind() {
        return KIND;
    }

    @Override
    public boolean supports(Message message) {
        return message.hasKind(MessageKind.TEXT) && firstUrl(message).isPresent();
    }

    /**
     * The first {@code http(s)} URL in the message text.
     */
    public static Optional<String> firstUrl(Message message) {
        if (message.getText() == null) {
            return Optional.empty();
        }
        Matcher matcher = URL.matcher(message.getText());
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    public static String detectProvider(String url) {
        for (Map.Entry<String, Pattern> entry : PROVIDER_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(url).find()) {
                return entry.getKey();
            }
        }
        return GENERIC_PROVIDER;
    }

    // ── mapToRequest ─────────────────────────────────────────────────────

    @Override
    public Map<String, Object> mapToRequest(Message message) {
        String url = firstUrl(message).orElseThrow();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("guid", message.getGuid());
        request.put("url", url);
        request.put("provider", detectProvider(url));
        log.debug("mapToRequest: guid={} → {}", message.getGuid(), request);
        return request;
    }

    // ── mapFromResponse ──────────────────────────────────────────────────

    @Override
    public Enrichment mapFromResponse(Message message, Map<String, Object> apiResponse) {
        String url = firstUrl(message).orElseThrow();
        Enrichment enrichment = Enrichment.builder()
                .kind(KIND)
                .provider(detectProvider(url))
                .model(getModel())
                .version("1.0")
                .createdAt(Instant.now().toString())
                .build();
        enrichment.setField("url", url);
        putIfPresent(enrichment, "title", apiResponse.get("title"));
        putIfPresent(enrichment, "summary", apiResponse.get("summary"));
        return enrichment;
    }

    private static void putIfPresent(Enrichment enrichment, String name, Object value) {
        if (value != null) {
            enrichment.setField(name, value);
        }
    }
}
