package com.chatcorpus.enrichment;

import com.chatcorpus.checkpoint.CheckpointJournal;
import com.chatcorpus.checkpoint.CheckpointManager;
import com.chatcorpus.checkpoint.CheckpointState;
import com.chatcorpus.checkpoint.CheckpointStats;
import com.chatcorpus.checkpoint.ConfigFingerprint;
import com.chatcorpus.checkpoint.FailedItem;
import com.chatcorpus.config.PipelineConfig;
import com.chatcorpus.incremental.DeltaDetector;
import com.chatcorpus.incremental.DeltaResult;
import com.chatcorpus.incremental.IncrementalState;
import com.chatcorpus.incremental.IncrementalStateStore;
import com.chatcorpus.model.Enrichment;
import com.chatcorpus.model.EnrichmentResult;
import com.chatcorpus.model.Message;
import com.chatcorpus.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single resumable enrichment pass over a message list.
 *
 * <p>Messages are handled strictly one at a time, in input order, with at most one
 * provider call in flight.  Each eligible message goes to the first configured
 * {@link Enricher} that {@linkplain Enricher#supports supports} it; calls are paced and
 * guarded by a {@link RateLimiter} owned by the run.</p>
 *
 * <h3>Failure handling</h3>
 * <p>A provider failure or timeout never aborts the run: it is recorded as a
 * {@link FailedItem} and the unenriched message is kept.  While the circuit breaker is
 * open, eligible messages pass through unenriched and are counted as skipped.  The only
 * error that escapes {@link #run} is a {@link com.chatcorpus.checkpoint.CheckpointMismatchException}
 * when resuming under a different configuration.</p>
 *
 * <h3>Checkpointing</h3>
 * <p>Every {@code checkpointInterval} messages the output produced so far is appended to
 * the {@link CheckpointJournal} and a {@link CheckpointState} is saved.  Both writes are
 * best-effort inside the loop; only the final checkpoint's failure is surfaced, via
 * {@link EnrichmentRunResult#getFinalCheckpointError()}.  A resumed run restores its
 * counters from the checkpoint and its prior output from the journal, so its result equals
 * that of an uninterrupted run.  The journal must be a guid-for-guid prefix of the current
 * input; otherwise the checkpoint is discarded and the run starts from the beginning.</p>
 *
 * <h3>Interruption</h3>
 * <p>If the calling thread is interrupted the loop stops; the message in flight is
 * dropped from the output and the final checkpoint records the last message that was
 * appended.  The interrupt flag is restored before returning.</p>
 */
@Slf4j
public class EnrichmentOrchestrator implements AutoCloseable {

    private final List<Enricher> enrichers;
    private final PipelineConfig.EnrichmentSection settings;
    private final CheckpointManager checkpointManager;
    private final IncrementalStateStore stateStore;
    private final DeltaDetector deltaDetector;
    private final Sleeper sleeper;
    private final Clock clock;

    public EnrichmentOrchestrator(List<Enricher> enrichers, PipelineConfig.EnrichmentSection settings) {
        this(enrichers, settings, new CheckpointManager(), new IncrementalStateStore(),
                new DeltaDetector(), Sleeper.SYSTEM, Clock.systemUTC());
    }

    public EnrichmentOrchestrator(List<Enricher> enrichers,
                                  PipelineConfig.EnrichmentSection settings,
                                  CheckpointManager checkpointManager,
                                  IncrementalStateStore stateStore,
                                  DeltaDetector deltaDetector,
                                  Sleeper sleeper,
                                  Clock clock) {
        this.enrichers = List.copyOf(enrichers);
        this.settings = settings;
        this.checkpointManager = checkpointManager;
        this.stateStore = stateStore;
        this.deltaDetector = deltaDetector;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    // ── Configuration fingerprint ────────────────────────────────────────

    /**
     * The settings that decide whether a checkpoint may be resumed: which providers are
     * enabled, the pacing delay and the retry budget.
     */
    public ConfigFingerprint fingerprint() {
        Map<String, Boolean> providers = new TreeMap<>();
        for (Enricher enricher : enrichers) {
            providers.put(enricher.getName(), Boolean.TRUE);
        }
        return ConfigFingerprint.builder()
                .providers(providers)
                .rateLimitDelayMs(settings.getRateLimitDelayMs())
                .maxRetries(settings.getMaxRetries())
                .build();
    }

    public String configHash() {
        return checkpointManager.computeConfigHash(fingerprint());
    }

    // ── Run ──────────────────────────────────────────────────────────────

    public EnrichmentRunResult run(List<Message> messages, RunOptions options) {
        if (options.getCheckpointInterval() <= 0) {
            throw new IllegalArgumentException("checkpointInterval must be positive");
        }
        String startTime = Instant.now(clock).toString();
        String configHash = configHash();
        Path checkpointPath = checkpointManager.checkpointPath(options.getCheckpointDir(), configHash);
        RunContext ctx = new RunContext(new CheckpointJournal(options.getCheckpointDir(), configHash));

        int startIndex = 0;
        if (options.isResume()) {
            startIndex = restore(checkpointPath, configHash, messages, ctx);
        }
        if (startIndex == 0) {
            startFresh(ctx);
        }

        // ── Incremental delta ────────────────────────────────────────────
        Set<String> delta = null;
        IncrementalState previousState = null;
        int newMessageCount = messages.size();
        if (options.isIncremental()) {
            previousState = loadPreviousState(options);
            DeltaResult deltaResult = deltaDetector.detect(messages, previousState);
            delta = new HashSet<>(deltaResult.getNewGuids());
            newMessageCount = deltaResult.getNewCount();
        }

        // ── Main loop ────────────────────────────────────────────────────
        RateLimiter rateLimiter = new RateLimiter(settings.getRateLimitDelayMs(),
                settings.getCircuitBreakerThreshold(), settings.getCircuitBreakerResetMs(), clock);
        log.info("Enriching messages [{}, {}) with {} enricher(s), checkpoint every {}",
                startIndex, messages.size(), enrichers.size(), options.getCheckpointInterval());

        boolean interrupted = false;
        int lastProcessedIndex = startIndex - 1;
        for (int i = startIndex; i < messages.size(); i++) {
            Message out;
            try {
                out = process(i, messages.get(i), delta, options.isForceRefresh(), rateLimiter, ctx);
            } catch (InterruptedException e) {
                interrupted = true;
                break;
            }
            ctx.output.add(out);
            ctx.pending.add(out);
            ctx.stats.setProcessedCount(ctx.stats.getProcessedCount() + 1);
            lastProcessedIndex = i;

            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                break;
            }
            if ((i + 1) % options.getCheckpointInterval() == 0) {
                String error = writeCheckpoint(i, configHash, checkpointPath, ctx);
                if (error != null) {
                    log.warn("Checkpoint at index {} failed; continuing: {}", i, error);
                }
            }
        }

        // Clear the flag so the final checkpoint can use interruptible file channels.
        if (interrupted) {
            Thread.interrupted();
            log.warn("Enrichment interrupted after index {}; writing final checkpoint", lastProcessedIndex);
        }
        String finalCheckpointError = writeCheckpoint(lastProcessedIndex, configHash, checkpointPath, ctx);
        if (finalCheckpointError != null) {
            log.error("Final checkpoint could not be written to {}: {}", checkpointPath, finalCheckpointError);
        }

        if (options.isIncremental()) {
            saveState(previousState, configHash, messages.size(), startTime, options, ctx);
        }

        EnrichmentRunResult result = EnrichmentRunResult.builder()
                .enriched(List.copyOf(ctx.output))
                .totalProcessed(ctx.stats.getProcessedCount())
                .totalFailed(ctx.stats.getFailedCount())
                .totalSkipped(ctx.stats.getSkippedCount())
                .failedItems(List.copyOf(ctx.failedItems))
                .startIndex(startIndex)
                .newMessageCount(newMessageCount)
                .checkpointPath(checkpointPath)
                .finalCheckpointError(finalCheckpointError)
                .interrupted(interrupted)
                .build();
        logSummary(result);

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return result;
    }

    @Override
    public void close() {
        for (Enricher enricher : enrichers) {
            enricher.close();
        }
    }

    // ──────────────────────── per message ─────────────────────────────────

    private Message process(int index, Message message, Set<String> delta, boolean forceRefresh,
                            RateLimiter rateLimiter, RunContext ctx) throws InterruptedException {
        Enricher enricher = selectEnricher(message, delta, forceRefresh);
        if (enricher == null) {
            return message;
        }
        if (rateLimiter.isCircuitOpen()) {
            ctx.stats.setSkippedCount(ctx.stats.getSkippedCount() + 1);
            log.debug("Circuit open; passing through guid={} unenriched", message.getGuid());
            return message;
        }

        long waitMs = rateLimiter.shouldRateLimit();
        if (waitMs > 0) {
            sleeper.sleep(waitMs);
        }
        rateLimiter.recordCall();

        EnrichmentResult result = invoke(enricher, message);
        if (result.isSuccess()) {
            rateLimiter.recordSuccess();
            ctx.stats.countEnrichment(result.getKind());
            return EnrichmentAttacher.attach(message, result.getEnrichment(), forceRefresh);
        }

        rateLimiter.recordFailure();
        ctx.failedItems.add(new FailedItem(index, message.getGuid(), result.getKind(), result.getErrorMessage()));
        ctx.stats.setFailedCount(ctx.stats.getFailedCount() + 1);
        log.warn("Enrichment failed for guid={} enricher={} index={}: {}",
                message.getGuid(), enricher.getName(), index, result.getErrorMessage());
        return message;
    }

    private Enricher selectEnricher(Message message, Set<String> delta, boolean forceRefresh) {
        if (delta != null && !delta.contains(message.getGuid())) {
            return null;
        }
        for (Enricher enricher : enrichers) {
            if (enricher.supports(message)) {
                if (!forceRefresh && EnrichmentAttacher.hasEnrichment(message, enricher.getEnrichmentKind())) {
                    log.debug("guid={} already has a {} enrichment; skipping",
                            message.getGuid(), enricher.getEnrichmentKind());
                    return null;
                }
                return enricher;
            }
        }
        return null;
    }

    private EnrichmentResult invoke(Enricher enricher, Message message) throws InterruptedException {
        String guid = message.getGuid();
        String kind = enricher.getEnrichmentKind();
        CompletableFuture<Enrichment> future;
        try {
            future = enricher.enrichAsync(message);
        } catch (RuntimeException e) {
            return EnrichmentResult.failure(guid, enricher.getName(), kind, describe(e));
        }

        try {
            Enrichment enrichment = future.get(enricher.getAsyncTimeoutMs(), TimeUnit.MILLISECONDS);
            if (enrichment == null) {
                return EnrichmentResult.failure(guid, enricher.getName(), kind, "Enricher returned no enrichment");
            }
            if (enrichment.getKind() == null) {
                enrichment.setKind(kind);
            }
            return EnrichmentResult.success(guid, enricher.getName(), enrichment);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return EnrichmentResult.failure(guid, enricher.getName(), kind, describe(cause));
        } catch (TimeoutException e) {
            future.cancel(true);
            return EnrichmentResult.failure(guid, enricher.getName(), kind,
                    "Timed out after " + enricher.getAsyncTimeoutMs() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    // ──────────────────────── checkpoints ─────────────────────────────────

    /**
     * @return the index to start from: {@code 0} when there is nothing usable to resume
     */
    private int restore(Path checkpointPath, String configHash, List<Message> messages, RunContext ctx) {
        int messageCount = messages.size();
        CheckpointState checkpoint = checkpointManager.loadCheckpoint(checkpointPath);
        if (checkpoint == null) {
            log.info("No checkpoint at {}; starting from the beginning", checkpointPath);
            return 0;
        }
        checkpointManager.verify(checkpoint, configHash);

        int resumeIndex = checkpoint.getResumeIndex();
        if (resumeIndex < 0 || resumeIndex > messageCount) {
            log.warn("Checkpoint {} points at index {} but the input has {} messages; starting fresh",
                    checkpointPath, checkpoint.getLastProcessedIndex(), messageCount);
            return 0;
        }

        List<Message> prior;
        try {
            prior = ctx.journal.readFirst(resumeIndex);
        } catch (IOException e) {
            log.warn("Could not read checkpoint journal {}; starting fresh: {}", ctx.journal.getPath(), e.getMessage());
            return 0;
        }
        if (prior == null) {
            log.warn("Checkpoint journal {} holds fewer than {} messages; starting fresh",
                    ctx.journal.getPath(), resumeIndex);
            return 0;
        }
        int divergence = firstGuidMismatch(prior, messages);
        if (divergence >= 0) {
            log.warn("Checkpoint journal {} diverges from the input at index {} (journal guid={}, input guid={}); "
                            + "starting fresh",
                    ctx.journal.getPath(), divergence, prior.get(divergence).getGuid(),
                    messages.get(divergence).getGuid());
            return 0;
        }

        try {
            ctx.journal.rewrite(prior);
        } catch (IOException e) {
            log.warn("Could not truncate checkpoint journal {}; it will be rewritten at the next checkpoint: {}",
                    ctx.journal.getPath(), e.getMessage());
            ctx.journalDirty = true;
        }

        ctx.output.addAll(prior);
        ctx.stats = checkpoint.getStats().copy();
        ctx.stats.setProcessedCount(checkpoint.getTotalProcessed());
        ctx.stats.setFailedCount(checkpoint.getTotalFailed());
        ctx.failedItems.addAll(checkpoint.getFailedItems());
        log.info("Resuming from checkpoint {}: startIndex={} processed={} failed={}",
                checkpointPath, resumeIndex, checkpoint.getTotalProcessed(), checkpoint.getTotalFailed());
        return resumeIndex;
    }

    /**
     * @return the first index at which the journalled output and the input disagree on
     *         guid, or {@code -1} when the journal is a prefix of the input
     */
    private static int firstGuidMismatch(List<Message> prior, List<Message> messages) {
        for (int i = 0; i < prior.size(); i++) {
            if (!Objects.equals(prior.get(i).getGuid(), messages.get(i).getGuid())) {
                return i;
            }
        }
        return -1;
    }

    private void startFresh(RunContext ctx) {
        ctx.output.clear();
        ctx.pending.clear();
        ctx.failedItems.clear();
        ctx.stats = new CheckpointStats();
        try {
            ctx.journal.delete();
            ctx.journalDirty = false;
        } catch (IOException e) {
            log.warn("Could not delete stale checkpoint journal {}: {}", ctx.journal.getPath(), e.getMessage());
            ctx.journalDirty = true;
        }
    }

    /**
     * Syncs the journal, then saves the checkpoint.  Never throws.
     *
     * @return {@code null} on success, otherwise a description of what failed
     */
    private String writeCheckpoint(int lastProcessedIndex, String configHash, Path checkpointPath, RunContext ctx) {
        try {
            if (ctx.journalDirty) {
                ctx.journal.rewrite(ctx.output);
            } else {
                ctx.journal.append(ctx.pending);
            }
            ctx.journalDirty = false;
        } catch (IOException e) {
            ctx.journalDirty = true;
            return "journal write failed: " + e.getMessage();
        } finally {
            ctx.pending.clear();
        }

        CheckpointState state = checkpointManager.createCheckpoint(lastProcessedIndex,
                ctx.stats.getProcessedCount(), ctx.stats.getFailedCount(), ctx.stats, ctx.failedItems, configHash);
        try {
            checkpointManager.saveCheckpoint(state, checkpointPath);
            return null;
        } catch (IOException e) {
            return "checkpoint write failed: " + e.getMessage();
        }
    }

    // ──────────────────────── incremental state ───────────────────────────

    private IncrementalState loadPreviousState(RunOptions options) {
        Path stateFile = options.getStateFile();
        if (options.isResetState()) {
            try {
                stateStore.reset(stateFile);
            } catch (IOException e) {
                log.warn("Could not delete incremental state {}; ignoring its contents: {}", stateFile, e.getMessage());
            }
            return null;
        }
        IncrementalState state = stateStore.load(stateFile);
        if (state != null) {
            stateStore.isOutdated(state, options.getStaleAfterDays());
        }
        return state;
    }

    private void saveState(IncrementalState previousState, String configHash, int totalMessages,
                           String startTime, RunOptions options, RunContext ctx) {
        IncrementalState state = previousState != null ? previousState : stateStore.create(totalMessages, configHash);
        state.getPipelineConfig().setConfigHash(configHash);

        List<String> guids = new ArrayList<>(ctx.output.size());
        for (Message message : ctx.output) {
            guids.add(message.getGuid());
        }
        IncrementalState.EnrichmentStats stats = new IncrementalState.EnrichmentStats(
                ctx.stats.getProcessedCount(), ctx.stats.getFailedCount(),
                startTime, Instant.now(clock).toString());
        stateStore.recordRun(state, guids, totalMessages, stats);

        try {
            stateStore.save(state, options.getStateFile());
        } catch (IOException e) {
            log.warn("Could not save incremental state to {}: {}", options.getStateFile(), e.getMessage());
        }
    }

    private static void logSummary(EnrichmentRunResult result) {
        log.info("Enrichment finished: processed={} failed={} skipped={} startIndex={} newMessages={}{}",
                result.getTotalProcessed(), result.getTotalFailed(), result.getTotalSkipped(),
                result.getStartIndex(), result.getNewMessageCount(),
                result.isInterrupted() ? " (interrupted)" : "");
        for (FailedItem item : result.getFailedItems()) {
            log.info("  failed index={} guid={} kind={}: {}",
                    item.getIndex(), item.getGuid(), item.getKind(), item.getError());
        }
    }

    /** Mutable state threaded through one run. */
    private static final class RunContext {
        private final CheckpointJournal journal;
        private final List<Message> output = new ArrayList<>();
        /** Output appended since the last journal sync. */
        private final List<Message> pending = new ArrayList<>();
        private final List<FailedItem> failedItems = new ArrayList<>();
        private CheckpointStats stats = new CheckpointStats();
        private boolean journalDirty;

        private RunContext(CheckpointJournal journal) {
            this.journal = journal;
        }
    }
}
