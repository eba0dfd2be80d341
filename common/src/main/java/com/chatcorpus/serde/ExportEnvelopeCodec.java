package com.chatcorpus.serde;

import com.chatcorpus.model.ExportEnvelope;
import com.chatcorpus.model.Message;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes {@link ExportEnvelope} files.
 *
 * <p>Input files may be either a full envelope object or a bare JSON array of messages
 * (the shape older exporters produced); both are returned as an envelope.</p>
 */
@Slf4j
public final class ExportEnvelopeCodec {

    private static final JavaType MESSAGE_LIST = JsonFiles.MAPPER.getTypeFactory()
            .constructCollectionType(List.class, Message.class);

    private ExportEnvelopeCodec() {
        // utility class
    }

    public static ExportEnvelope read(Path path) throws IOException {
        JsonNode root = JsonFiles.MAPPER.readTree(path.toFile());
        if (root == null || root.isMissingNode()) {
            throw new IOException("Empty export file: " + path);
        }
        if (root.isArray()) {
            List<Message> messages = JsonFiles.MAPPER.convertValue(root, MESSAGE_LIST);
            log.debug("Read bare message array ({} messages) from {}", messages.size(), path);
            return ExportEnvelope.builder()
                    .schemaVersion(ExportEnvelope.SCHEMA_VERSION)
                    .messages(messages)
                    .build();
        }
        if (!root.isObject() || !root.path("messages").isArray()) {
            throw new IOException("Not an export envelope (no 'messages' array): " + path);
        }
        ExportEnvelope envelope = JsonFiles.MAPPER.treeToValue(root, ExportEnvelope.class);
        log.debug("Read envelope schemaVersion={} source={} ({} messages) from {}",
                envelope.getSchemaVersion(), envelope.getSource(), envelope.getMessages().size(), path);
        return envelope;
    }

    public static void write(Path path, ExportEnvelope envelope) throws IOException {
        JsonFiles.writeAtomically(path, envelope);
    }
}
