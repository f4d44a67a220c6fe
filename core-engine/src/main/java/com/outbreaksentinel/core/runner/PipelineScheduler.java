package com.outbreaksentinel.core.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the pipeline on a fixed interval and on demand.
 *
 * <p>
 * Scheduled and manual runs share one worker thread, so they never overlap;
 * a manual trigger during a scheduled pass runs right after it.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineRunner runner;
    private final Duration interval;
    private final ScheduledExecutorService worker;
    private volatile boolean started;

    public PipelineScheduler(PipelineRunner runner, Duration interval) {
        this.runner = Objects.requireNonNull(runner, "PipelineRunner must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        this.worker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pipeline-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the recurring schedule; the first run starts immediately.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Scheduler already started");
        }
        started = true;
        worker.scheduleWithFixedDelay(this::scheduledRun, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Pipeline scheduled every {}", interval);
    }

    /**
     * Queue a manual run.
     *
     * @return completes with the run's report
     */
    public CompletableFuture<RunReport> runNow() {
        LOG.info("Manual run requested");
        return CompletableFuture.supplyAsync(() -> runner.run(PipelineRunner.TRIGGER_MANUAL), worker);
    }

    private void scheduledRun() {
        try {
            runner.run(PipelineRunner.TRIGGER_SCHEDULED);
        } catch (RuntimeException e) {
            // an escaping exception would cancel every later scheduled run
            LOG.error("Scheduled run failed", e);
        }
    }

    public PipelineRunner getRunner() {
        return runner;
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public void close() {
        worker.shutdownNow();
        LOG.info("Pipeline scheduler stopped");
    }
}
