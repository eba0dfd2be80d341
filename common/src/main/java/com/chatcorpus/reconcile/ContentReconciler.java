package com.chatcorpus.reconcile;

import com.chatcorpus.model.MediaInfo;
import com.chatcorpus.model.Message;
import com.chatcorpus.model.MessageKind;
import com.chatcorpus.model.ReplyInfo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Merges a primary message collection (typically CSV-derived) with an authoritative one
 * (typically DB-derived) into a single collection without loss or duplication.
 *
 * <h3>Matching</h3>
 * <ol>
 *   <li>Both inputs are sorted by {@code guid} (ordinal order) so the result does not
 *       depend on input order.</li>
 *   <li><b>Exact match</b>: a primary message whose guid exists in the authoritative set
 *       is merged with it.  All exact matches are resolved before any content matching.</li>
 *   <li><b>Content match</b>, only without an exact match: the first unconsumed
 *       authoritative message with the same kind and handle and either equal normalised
 *       text (text messages) or equal {@code media.id} (media messages).  Tapbacks and
 *       notifications are never content-matched.</li>
 *   <li>Unmatched primary messages pass through; unconsumed authoritative messages are
 *       appended.</li>
 *   <li>The output is sorted by guid (stable), so reconciling a result again against an
 *       empty authoritative set returns it unchanged.  Emitting sorted primaries followed by
 *       the leftover authoritative messages would break that idempotence whenever a
 *       leftover sorts before a primary, so guid order wins over append order.</li>
 * </ol>
 *
 * <h3>Field authoritativeness</h3>
 * <p>On a match the authoritative side wins for {@code guid}, {@code date},
 * {@code dateRead}, {@code dateDelivered}, {@code dateEdited}, {@code handle},
 * {@code isRead} and {@code replyingTo.targetMessageGuid} whenever it carries a value.
 * Every other field keeps the primary value and is only filled from the authoritative
 * side when the primary lacks it.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
@Slf4j
public class ContentReconciler {

    private static final Comparator<Message> BY_GUID =
            Comparator.comparing(Message::getGuid, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public MergeResult reconcile(List<Message> primary, List<Message> authoritative) {
        List<Message> sortedPrimary = sorted(primary);
        List<Message> sortedAuthoritative = sorted(authoritative);

        MergeStats stats = new MergeStats();
        stats.setCsvCount(sortedPrimary.size());
        stats.setDbCount(sortedAuthoritative.size());

        Map<String, Integer> guidIndex = new HashMap<>();
        for (int i = 0; i < sortedAuthoritative.size(); i++) {
            guidIndex.putIfAbsent(sortedAuthoritative.get(i).getGuid(), i);
        }
        Map<String, Deque<Integer>> contentIndex = buildContentIndex(sortedAuthoritative);
        boolean[] consumed = new boolean[sortedAuthoritative.size()];

        List<Message> output = new ArrayList<>(sortedPrimary.size() + sortedAuthoritative.size());

        // Exact matches are claimed before any content matching so a content match can
        // never take an authoritative record that a later primary owns by guid.
        Message[] merged = new Message[sortedPrimary.size()];
        for (int p = 0; p < sortedPrimary.size(); p++) {
            Message message = sortedPrimary.get(p);
            Integer exact = guidIndex.get(message.getGuid());
            if (exact != null && !consumed[exact]) {
                consumed[exact] = true;
                merged[p] = applyAuthoritative(message, sortedAuthoritative.get(exact));
                stats.setExactMatches(stats.getExactMatches() + 1);
            }
        }

        for (int p = 0; p < sortedPrimary.size(); p++) {
            if (merged[p] != null) {
                continue;
            }
            Message message = sortedPrimary.get(p);
            Optional<Integer> contentHit = nextUnconsumed(contentIndex.get(contentKey(message)), consumed);
            if (contentHit.isPresent()) {
                int index = contentHit.get();
                consumed[index] = true;
                Message candidate = sortedAuthoritative.get(index);
                ContentMatch match = describeMatch(message, candidate);
                log.debug("Content match {} -> {} ({})", message.getGuid(), candidate.getGuid(), match.getReasons());
                merged[p] = applyAuthoritative(message, candidate);
                stats.setContentMatches(stats.getContentMatches() + 1);
            } else {
                merged[p] = message;
                stats.setNoMatches(stats.getNoMatches() + 1);
            }
        }
        output.addAll(Arrays.asList(merged));

        for (int i = 0; i < sortedAuthoritative.size(); i++) {
            if (!consumed[i]) {
                output.add(sortedAuthoritative.get(i));
            }
        }

        output.sort(BY_GUID);
        stats.setOutputCount(output.size());
        if (!stats.isConsistent()) {
            log.error("Merge accounting does not add up: {}", stats);
        }
        log.info("Merged {} primary + {} authoritative -> {} messages (exact={}, content={}, unmatched={})",
                stats.getCsvCount(), stats.getDbCount(), stats.getOutputCount(),
                stats.getExactMatches(), stats.getContentMatches(), stats.getNoMatches());
        return new MergeResult(output, stats);
    }

    /**
     * Finds the first candidate, in the order given, that is content-equivalent to
     * {@code message}.
     */
    public Optional<ContentMatch> findContentMatch(Message message, List<Message> candidates) {
        String key = contentKey(message);
        if (key == null) {
            return Optional.empty();
        }
        for (Message candidate : candidates) {
            if (key.equals(contentKey(candidate))) {
                return Optional.of(describeMatch(message, candidate));
            }
        }
        return Optional.empty();
    }

    /**
     * Lower-cases, strips punctuation and collapses whitespace.
     */
    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT).trim();
        String stripped = PUNCTUATION.matcher(lowered).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Merges a matched pair, returning a new message; neither argument is modified.
     */
    public Message applyAuthoritative(Message primary, Message authoritative) {
        Message merged = primary.copy();

        // ── Authoritative side wins when it has a value ──────────────────
        if (authoritative.getGuid() != null) {
            merged.setGuid(authoritative.getGuid());
        }
        if (authoritative.getDate() != null) {
            merged.setDate(authoritative.getDate());
        }
        if (authoritative.getDateRead() != null) {
            merged.setDateRead(authoritative.getDateRead());
        }
        if (authoritative.getDateDelivered() != null) {
            merged.setDateDelivered(authoritative.getDateDelivered());
        }
        if (authoritative.getDateEdited() != null) {
            merged.setDateEdited(authoritative.getDateEdited());
        }
        if (authoritative.getHandle() != null) {
            merged.setHandle(authoritative.getHandle());
        }
        if (authoritative.getIsRead() != null) {
            merged.setIsRead(authoritative.getIsRead());
        }

        Message source = authoritative.copy();
        ReplyInfo authoritativeReply = source.getReplyingTo();
        if (merged.getReplyingTo() == null) {
            merged.setReplyingTo(authoritativeReply);
        } else if (authoritativeReply != null) {
            ReplyInfo reply = merged.getReplyingTo();
            if (authoritativeReply.getTargetMessageGuid() != null) {
                reply.setTargetMessageGuid(authoritativeReply.getTargetMessageGuid());
            }
            if (reply.getSender() == null) {
                reply.setSender(authoritativeReply.getSender());
            }
            if (reply.getDate() == null) {
                reply.setDate(authoritativeReply.getDate());
            }
            if (reply.getText() == null) {
                reply.setText(authoritativeReply.getText());
            }
        }

        // ── Primary side wins, gaps filled from the authoritative side ───
        if (merged.getMessageKind() == null) {
            merged.setMessageKind(source.getMessageKind());
        }
        if (merged.getIsFromMe() == null) {
            merged.setIsFromMe(source.getIsFromMe());
        }
        if (merged.getService() == null) {
            merged.setService(source.getService());
        }
        if (merged.getChatId() == null) {
            merged.setChatId(source.getChatId());
        }
        if (merged.getText() == null) {
            merged.setText(source.getText());
        }
        if (merged.getMedia() == null) {
            merged.setMedia(source.getMedia());
        }
        if (merged.getTapback() == null) {
            merged.setTapback(source.getTapback());
        }
        if (merged.getEnrichment() == null) {
            merged.setEnrichment(source.getEnrichment());
        }
        source.getExtra().forEach((name, value) -> {
            if (!merged.getExtra().containsKey(name)) {
                merged.setExtra(name, value);
            }
        });
        return merged;
    }

    // ──────────────────────── internals ──────────────────────────────────

    private static List<Message> sorted(List<Message> messages) {
        List<Message> copy = new ArrayList<>(messages);
        copy.sort(BY_GUID);
        return copy;
    }

    /**
     * Key under which two messages are content-equivalent, or {@code null} when the
     * message kind is never content-matched.
     */
    private static String contentKey(Message message) {
        MessageKind kind = message.getMessageKind();
        String handle = message.getHandle() == null || message.getHandle().isEmpty()
                ? "" : message.getHandle();
        if (kind == MessageKind.TEXT) {
            return "text\u0000" + handle + "\u0000" + normalizeText(message.getText());
        }
        if (kind == MessageKind.MEDIA) {
            MediaInfo media = message.getMedia();
            if (media == null || media.getId() == null || media.getId().isEmpty()) {
                return null;
            }
            return "media\u0000" + handle + "\u0000" + media.getId();
        }
        return null;
    }

    private static Map<String, Deque<Integer>> buildContentIndex(List<Message> sortedAuthoritative) {
        Map<String, Deque<Integer>> index = new HashMap<>();
        for (int i = 0; i < sortedAuthoritative.size(); i++) {
            String key = contentKey(sortedAuthoritative.get(i));
            if (key != null) {
                index.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(i);
            }
        }
        return index;
    }

    private static Optional<Integer> nextUnconsumed(Deque<Integer> candidates, boolean[] consumed) {
        if (candidates == null) {
            return Optional.empty();
        }
        while (!candidates.isEmpty()) {
            int index = candidates.peekFirst();
            if (!consumed[index]) {
                return Optional.of(index);
            }
            candidates.pollFirst();
        }
        return Optional.empty();
    }

    private static ContentMatch describeMatch(Message message, Message candidate) {
        String reason = message.getMessageKind() == MessageKind.MEDIA
                ? "exact media ID match"
                : "exact text match after normalization";
        return new ContentMatch(candidate, 1.0, List.of(reason));
    }
}
