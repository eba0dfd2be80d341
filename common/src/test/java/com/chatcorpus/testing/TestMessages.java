package com.chatcorpus.testing;

import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.MediaInfo;
import com.chatcorpus.model.MediaKind;
import com.chatcorpus.model.Message;
import com.chatcorpus.model.MessageKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Message fixtures.
 */
public final class TestMessages {

    private TestMessages() {
        // utility class
    }

    public static Message text(String guid, String handle, String text) {
        return Message.builder()
                .guid(guid)
                .messageKind(MessageKind.TEXT)
                .handle(handle)
                .text(text)
                .isFromMe(Boolean.FALSE)
                .build();
    }

    public static Message media(String guid, String handle, String mediaId, MediaKind mediaKind) {
        return Message.builder()
                .guid(guid)
                .messageKind(MessageKind.MEDIA)
                .handle(handle)
                .isFromMe(Boolean.FALSE)
                .media(MediaInfo.builder()
                        .id(mediaId)
                        .filename(mediaId + ".bin")
                        .path("/tmp/" + mediaId + ".bin")
                        .mediaKind(mediaKind)
                        .build())
                .build();
    }

    public static Message image(String guid) {
        return media(guid, "+15550001111", "media:" + guid, MediaKind.IMAGE);
    }

    /** {@code count} image messages with guids {@code m000}, {@code m001}, ... */
    public static List<Message> images(int count) {
        List<Message> messages = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            messages.add(image(String.format("m%03d", i)));
        }
        return messages;
    }

    public static Enrichment enrichment(String kind, String createdAt) {
        Enrichment enrichment = Enrichment.builder()
                .kind(kind)
                .provider("test")
                .version("1.0")
                .createdAt(createdAt)
                .build();
        enrichment.setField("summary", kind + "@" + createdAt);
        return enrichment;
    }
}
