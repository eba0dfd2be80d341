package com.chatcorpus.checkpoint;

import com.chatcorpus.model.Message;
import com.chatcorpus.serde.JsonFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * NDJSON sidecar holding the output messages a checkpoint covers, one message per line,
 * in processing order.
 *
 * <p>The checkpoint file only records counters and an index; the journal holds the
 * corresponding output so a resumed run can hand back the same full list an
 * uninterrupted run would have.  The orchestrator appends to the journal <em>before</em>
 * writing the checkpoint, so the journal is never shorter than a successfully written
 * checkpoint claims.</p>
 *
 * <p>File name: {@code <dir>/enrich-checkpoint-<hash>.messages.ndjson}.</p>
 */
@Slf4j
public class CheckpointJournal {

    private final Path path;

    public CheckpointJournal(Path checkpointDir, String configHash) {
        this.path = checkpointDir.resolve(CheckpointManager.FILE_PREFIX + configHash + ".messages.ndjson");
    }

    public Path getPath() {
        return path;
    }

    /**
     * Appends {@code messages} as new lines.
     */
    public void append(List<Message> messages) throws IOException {
        if (messages.isEmpty()) {
            return;
        }
        Files.createDirectories(path.toAbsolutePath().getParent());
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            writeLines(writer, messages);
        }
    }

    /**
     * Atomically replaces the journal with exactly {@code messages}.
     */
    public void rewrite(List<Message> messages) throws IOException {
        JsonFiles.writeAtomically(path, out -> {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            writeLines(writer, messages);
            writer.flush();
        });
    }

    /**
     * Reads the first {@code count} journalled messages.
     *
     * @return the messages, or {@code null} when the journal is missing or holds fewer
     *         than {@code count} readable lines
     */
    public List<Message> readFirst(int count) throws IOException {
        if (count == 0) {
            return new ArrayList<>();
        }
        if (!Files.isRegularFile(path)) {
            return null;
        }
        List<Message> messages = new ArrayList<>(count);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while (messages.size() < count && (line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    messages.add(JsonFiles.COMPACT_MAPPER.readValue(line, Message.class));
                } catch (JsonProcessingException e) {
                    log.warn("Journal {} has an unreadable line {}; stopping there: {}",
                            path, lineNumber, e.getOriginalMessage());
                    break;
                }
            }
        }
        return messages.size() < count ? null : messages;
    }

    public void delete() throws IOException {
        Files.deleteIfExists(path);
    }

    private static void writeLines(Writer writer, List<Message> messages) throws IOException {
        for (Message message : messages) {
            writer.write(JsonFiles.COMPACT_MAPPER.writeValueAsString(message));
            writer.write('\n');
        }
    }
}
