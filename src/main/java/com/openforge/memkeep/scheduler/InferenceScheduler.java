package com.openforge.memkeep.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memkeep.llm.GenerationConfig;
import com.openforge.memkeep.llm.InferencePurpose;
import com.openforge.memkeep.llm.LlmProperties;
import com.openforge.memkeep.llm.ReasoningService;
import com.openforge.memkeep.stream.ConversationTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The only path to the {@link ReasoningService}.
 *
 * Per call, in order:
 *   1. foreground purposes take the single-flight {@link InferenceLock}
 *   2. the fair dispatch lock serializes every call, whatever its purpose
 *   3. a payload dispatched within the dedup window is answered with ""
 *   4. the thread sleeps out the rest of the minimum spacing
 *   5. the call runs on the dedicated inference executor under a hard timeout
 *
 * Failures never escape: foreground purposes degrade to an apology carrying a
 * short error reference, everything else degrades to "".  Callers treat "" as
 * "proceed without this data".
 */
@Slf4j
@Service
public class InferenceScheduler {

    public static final String DEGRADED_REPLY_PREFIX =
            "[System Error] My reasoning core timed out or disconnected.";

    private static final int ERROR_REF_LENGTH = 50;

    private final ReasoningService    reasoning;
    private final SchedulerProperties properties;
    private final int                 maxOutputTokens;
    private final Clock               clock;
    private final Sleeper             sleeper;
    private final Executor            executor;
    private final ObjectMapper        objectMapper;

    private final ReentrantLock    dispatchLock = new ReentrantLock(true);
    private final InferenceLock    inferenceLock;
    private final PromptDedupCache dedupCache;

    // guarded by dispatchLock
    private Instant lastDispatch;

    public InferenceScheduler(ReasoningService reasoning,
                              SchedulerProperties properties,
                              LlmProperties llmProperties,
                              Clock clock,
                              Sleeper sleeper,
                              @Qualifier("inferenceCallExecutor") Executor executor,
                              ObjectMapper objectMapper) {
        this.reasoning       = reasoning;
        this.properties      = properties;
        this.maxOutputTokens = llmProperties.maxOutputTokens();
        this.clock           = clock;
        this.sleeper         = sleeper;
        this.executor        = executor;
        this.objectMapper    = objectMapper;
        this.inferenceLock   = new InferenceLock(clock, properties.lockTimeout());
        this.dedupCache      = new PromptDedupCache(properties.dedupWindow(), properties.dedupCapacity());
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Dispatches one reasoning call.
     *
     * @return the model's text, "" for suppressed or failed background calls,
     *         or the degraded apology for failed foreground calls
     */
    public String schedule(InferencePurpose purpose, InferenceRequest request) {
        boolean foreground = purpose.isForeground();
        long stamp = 0;
        boolean locked = false;
        try {
            if (foreground) {
                stamp = inferenceLock.acquire();
                locked = true;
            }
            dispatchLock.lockInterruptibly();
            try {
                return dispatch(purpose, request);
            } finally {
                dispatchLock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return degrade(purpose, "interrupted while waiting for dispatch");
        } finally {
            if (locked) {
                inferenceLock.release(stamp);
            }
        }
    }

    /** True while a foreground call holds the single-flight lock or any call is dispatching. */
    public boolean isInferenceBusy() {
        return inferenceLock.isHeld() || dispatchLock.isLocked();
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    private String dispatch(InferencePurpose purpose, InferenceRequest request) throws InterruptedException {
        Instant now = clock.instant();
        String fingerprint = fingerprint(request);
        if (dedupCache.isRecent(fingerprint, now)) {
            log.warn("[Scheduler] Suppressing duplicate {} call.", purpose);
            return "";
        }

        if (lastDispatch != null) {
            Duration since = Duration.between(lastDispatch, now);
            if (since.compareTo(properties.minSpacing()) < 0) {
                Duration wait = properties.minSpacing().minus(since);
                log.debug("[Scheduler] Throttling {} for {} ms.", purpose, wait.toMillis());
                sleeper.sleep(wait);
            }
        }

        Instant dispatchedAt = clock.instant();
        dedupCache.record(fingerprint, dispatchedAt);
        lastDispatch = dispatchedAt;

        return invoke(purpose, request);
    }

    private String invoke(InferencePurpose purpose, InferenceRequest request) throws InterruptedException {
        GenerationConfig config = GenerationConfig.forPurpose(purpose, maxOutputTokens);
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> request.hasImage()
                    ? reasoning.generateWithImage(request.systemContext(), request.turns(), request.image(), config)
                    : reasoning.generate(request.systemContext(), request.turns(), config), executor);
        } catch (RejectedExecutionException e) {
            return degrade(purpose, "executor saturated");
        }

        try {
            String text = future.get(properties.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return text == null ? "" : text;
        } catch (TimeoutException e) {
            future.cancel(true);
            return degrade(purpose, "Reasoning call timed out (%ds)".formatted(properties.callTimeout().toSeconds()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return degrade(purpose, String.valueOf(cause.getMessage()));
        }
    }

    private String degrade(InferencePurpose purpose, String error) {
        log.warn("[Scheduler] {} call failed: {}", purpose, error);
        if (!purpose.isForeground()) {
            return "";
        }
        String ref = error.length() > ERROR_REF_LENGTH ? error.substring(0, ERROR_REF_LENGTH) : error;
        return DEGRADED_REPLY_PREFIX + " (Ref: " + ref + ")";
    }

    /** Trailing slice of the serialized payload. */
    private String fingerprint(InferenceRequest request) {
        List<ConversationTurn> payload = new ArrayList<>(request.turns().size() + 1);
        if (!request.systemContext().isEmpty()) {
            payload.add(ConversationTurn.system(request.systemContext()));
        }
        payload.addAll(request.turns());
        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            serialized = payload.toString();
        }
        if (request.hasImage()) {
            serialized = serialized + "#image:" + request.image().data().length;
        }
        int length = properties.fingerprintLength();
        return serialized.length() <= length ? serialized : serialized.substring(serialized.length() - length);
    }
}
