package com.outbreaksentinel.core.narrative;

import com.outbreaksentinel.core.model.FusionResult;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.validation.Case;
import com.outbreaksentinel.core.validation.EvidenceAssembler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.TestCells.cell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeBoundedNarrator}.
 */
class TimeBoundedNarratorTest {

    private static final String FALLBACK = "severity high: composite 0.750";

    static Case escalatedCase() {
        MetricCell cell = cell("district-9", TODAY, 40, 60);
        FusionResult fusion = new FusionResult(cell.getKey(), 0.75, 0.8, Map.of(), Map.of(), Map.of(),
                Set.copyOf(cell.getSources()), 4, 6, "input");
        return Case.open("run-1", cell, fusion, new EvidenceAssembler().assemble(cell, fusion), 0);
    }

    @Test
    @DisplayName("Should return the assistant's text, trimmed")
    void returnsAssistantText() {
        TimeBoundedNarrator narrator = new TimeBoundedNarrator(c -> "  Fever cases tripled.  ",
                Duration.ofSeconds(1), Runnable::run);

        assertThat(narrator.narrate(escalatedCase(), FALLBACK)).isEqualTo("Fever cases tripled.");
    }

    @Test
    @DisplayName("Should fall back when the assistant fails")
    void fallsBackOnFailure() {
        TimeBoundedNarrator narrator = new TimeBoundedNarrator(c -> {
            throw new NarrativeUnavailableException("HTTP 503");
        }, Duration.ofSeconds(1), Runnable::run);

        assertThat(narrator.narrate(escalatedCase(), FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    @DisplayName("Should fall back on blank text")
    void fallsBackOnBlankText() {
        TimeBoundedNarrator narrator = new TimeBoundedNarrator(c -> "   ", Duration.ofSeconds(1), Runnable::run);

        assertThat(narrator.narrate(escalatedCase(), FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    @DisplayName("Should fall back within the timeout when the assistant hangs")
    void fallsBackOnTimeout() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            TimeBoundedNarrator narrator = new TimeBoundedNarrator(c -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "late";
            }, Duration.ofMillis(50), executor);

            long started = System.nanoTime();
            String narrative = narrator.narrate(escalatedCase(), FALLBACK);

            assertThat(narrative).isEqualTo(FALLBACK);
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5_000);
        } finally {
            release.countDown();
            executor.shutdownNow();
            executor.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    @DisplayName("Should never call out in numeric-only mode")
    void numericOnly() {
        assertThat(TimeBoundedNarrator.numericOnly().narrate(escalatedCase(), FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    @DisplayName("Should reject a non-positive timeout")
    void rejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> new TimeBoundedNarrator(c -> "x", Duration.ZERO, Runnable::run))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
