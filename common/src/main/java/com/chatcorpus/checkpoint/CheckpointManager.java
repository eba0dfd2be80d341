package com.chatcorpus.checkpoint;

import com.chatcorpus.serde.JsonFiles;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Creates, persists and restores {@link CheckpointState} snapshots.
 *
 * <p>There is one checkpoint file per configuration fingerprint
 * ({@code <dir>/enrich-checkpoint-<hash>.json}), not one per run: re-running with an
 * identical configuration resumes the same file, while any change to the fingerprint
 * lands in a different file and therefore starts fresh.</p>
 */
@Slf4j
public class CheckpointManager {

    public static final String FILE_PREFIX = "enrich-checkpoint-";

    /** Sorted keys so the same configuration always hashes the same way. */
    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final Clock clock;

    public CheckpointManager() {
        this(Clock.systemUTC());
    }

    public CheckpointManager(Clock clock) {
        this.clock = clock;
    }

    // ── Fingerprint ──────────────────────────────────────────────────────

    /**
     * SHA-256 (hex) of the canonical JSON form of {@code fingerprint}.
     */
    public String computeConfigHash(ConfigFingerprint fingerprint) {
        try {
            byte[] canonical = CANONICAL_MAPPER.writeValueAsString(fingerprint).getBytes(StandardCharsets.UTF_8);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise config fingerprint", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Path checkpointPath(Path dir, String configHash) {
        return dir.resolve(FILE_PREFIX + configHash + ".json");
    }

    // ── Snapshot lifecycle ───────────────────────────────────────────────

    /**
     * Pure constructor: copies the inputs and stamps the version and creation time.
     */
    public CheckpointState createCheckpoint(int lastProcessedIndex,
                                            int totalProcessed,
                                            int totalFailed,
                                            CheckpointStats stats,
                                            List<FailedItem> failedItems,
                                            String configHash) {
        return CheckpointState.builder()
                .version(CheckpointState.CURRENT_VERSION)
                .configHash(configHash)
                .lastProcessedIndex(lastProcessedIndex)
                .totalProcessed(totalProcessed)
                .totalFailed(totalFailed)
                .stats(stats == null ? new CheckpointStats() : stats.copy())
                .failedItems(failedItems == null ? new ArrayList<>() : new ArrayList<>(failedItems))
                .createdAt(Instant.now(clock).toString())
                .build();
    }

    /**
     * Atomically replaces whatever is at {@code path} with {@code state}.
     */
    public void saveCheckpoint(CheckpointState state, Path path) throws IOException {
        JsonFiles.writeAtomically(path, state);
        log.debug("Checkpoint saved: lastProcessedIndex={} processed={} failed={} -> {}",
                state.getLastProcessedIndex(), state.getTotalProcessed(), state.getTotalFailed(), path);
    }

    /**
     * @return the stored checkpoint, or {@code null} when the file is absent or unreadable
     */
    public CheckpointState loadCheckpoint(Path path) {
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try {
            return JsonFiles.MAPPER.readValue(path.toFile(), CheckpointState.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * @throws CheckpointMismatchException when the checkpoint was written under another configuration
     */
    public void verify(CheckpointState checkpoint, String currentHash) {
        if (!currentHash.equals(checkpoint.getConfigHash())) {
            throw new CheckpointMismatchException(checkpoint.getConfigHash(), currentHash);
        }
    }
}
