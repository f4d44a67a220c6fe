package com.outbreaksentinel.flink;

import com.outbreaksentinel.core.baseline.BaselineStore;
import com.outbreaksentinel.core.baseline.JsonLinesCellRepository;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.runner.AuditTrail;
import com.outbreaksentinel.core.runner.DeferralRegistry;
import com.outbreaksentinel.core.runner.JsonFileRunStateStore;
import com.outbreaksentinel.core.runner.LocalRunExecutor;
import com.outbreaksentinel.core.runner.PipelineRunner;
import com.outbreaksentinel.core.runner.PipelineScheduler;
import com.outbreaksentinel.core.runner.RunExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Outbreak Sentinel service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON-lines MetricCells (CELL_INPUT_DIR)
 *     → PipelineRunner (cursor, fingerprints and deferrals in RUN_STATE_PATH)
 *     → FlinkRunExecutor: key by location → CellPipelineFunction
 *     → alerts in ALERT_STORE_DIR, notifications via log / webhook / Kafka
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Service configuration is resolved from environment variables via
 * {@link JobConfig}; pipeline thresholds, action rules and recipients come
 * from the YAML {@link PipelineSettings}.
 * </p>
 *
 * <h3>Triggers</h3>
 * <p>
 * Runs start every {@code SCHEDULE_INTERVAL_SECONDS} and on
 * {@code POST /runs} of the {@link ControlServer}. The process runs until it
 * receives a shutdown signal.
 * </p>
 *
 * @since 1.0.0
 */
public final class OutbreakSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(OutbreakSentinelJob.class);

    private OutbreakSentinelJob() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Outbreak Sentinel with config: {}", config);

        // 2. Load pipeline settings and wire the core services
        PipelineComponents components = PipelineComponents.load(config);
        PipelineSettings settings = components.getSettings();
        LOG.info("Loaded pipeline settings: {} action rule(s), {} recipient rule(s), environment mode '{}'",
                settings.getActions().size(), settings.getRecipients().size(), settings.getEnvironment().getMode());

        // 3. Runner and scheduler
        RunExecutor executor = createExecutor(config, components);
        JsonLinesCellRepository cells = new JsonLinesCellRepository(Path.of(config.getCellInputDir()));
        PipelineRunner runner = new PipelineRunner(
                cells,
                new BaselineStore(cells, settings.getScoring().getLookbackDays()),
                executor,
                new DeferralRegistry(),
                new AuditTrail(),
                Clock.systemUTC(),
                config.getInitialLookbackDays(),
                new JsonFileRunStateStore(Path.of(config.getRunStatePath())));
        PipelineScheduler scheduler = new PipelineScheduler(runner, config.scheduleInterval());

        // 4. Control server (health checks, run trigger, status, alert transitions)
        ControlServer controlServer = new ControlServer(scheduler, components.lifecycle());
        controlServer.start(config.getControlPort());

        // 5. Run until shutdown
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            controlServer.stop();
            scheduler.close();
            if (executor instanceof LocalRunExecutor local) {
                local.close();
            }
            components.close();
            shutdown.countDown();
        }, "outbreak-sentinel-shutdown"));

        scheduler.start();
        shutdown.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static RunExecutor createExecutor(JobConfig config, PipelineComponents components) {
        if (config.isFlinkMode()) {
            LOG.info("Runs execute as Flink batch jobs with parallelism {}", config.getParallelism());
            return new FlinkRunExecutor(components, config.getParallelism());
        }
        LOG.info("Runs execute in-process on {} thread(s)", config.getParallelism());
        return new LocalRunExecutor(components.processor(), config.getParallelism());
    }
}
