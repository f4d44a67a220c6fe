package com.outbreaksentinel.core.narrative;

import com.outbreaksentinel.core.validation.Case;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls a {@link NarrativeAssistant} with a hard timeout and falls back to the
 * numeric rationale on timeout or failure.
 *
 * <p>
 * {@link #narrate(Case, String)} never throws and never waits longer than the
 * configured timeout, so escalation stays deterministic whether or not the
 * assistant is reachable.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeBoundedNarrator {

    private static final Logger LOG = LoggerFactory.getLogger(TimeBoundedNarrator.class);

    private final NarrativeAssistant assistant;
    private final Duration timeout;
    private final Executor executor;

    /**
     * @param assistant the assistant, or {@code null} to always use the fallback
     * @param timeout   bound on each call
     * @param executor  executor the assistant call runs on
     */
    public TimeBoundedNarrator(NarrativeAssistant assistant, Duration timeout, Executor executor) {
        this.assistant = assistant;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    /**
     * @return a narrator that never calls out and always returns the fallback
     */
    public static TimeBoundedNarrator numericOnly() {
        return new TimeBoundedNarrator(null, Duration.ofSeconds(1), Runnable::run);
    }

    /**
     * @param escalated case with severity and actions set
     * @param fallback  numeric rationale used when the assistant is unavailable
     * @return the assistant's narrative, or {@code fallback}
     */
    public String narrate(Case escalated, String fallback) {
        if (assistant == null) {
            return fallback;
        }

        CompletableFuture<String> future = CompletableFuture
                .supplyAsync(() -> assistant.generateRationale(escalated), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            String text = future.get();
            if (text == null || text.isBlank()) {
                LOG.warn("Narrative assistant returned no text for {} – using numeric rationale",
                        escalated.getKey());
                return fallback;
            }
            return text.strip();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Interrupted waiting for narrative for {} – using numeric rationale", escalated.getKey());
            return fallback;
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof TimeoutException) {
                LOG.warn("Narrative for {} timed out after {} ms – using numeric rationale",
                        escalated.getKey(), timeout.toMillis());
            } else {
                LOG.warn("Narrative for {} unavailable – using numeric rationale: {}",
                        escalated.getKey(), cause.getMessage());
            }
            return fallback;
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
