package com.outbreaksentinel.flink;

import com.outbreaksentinel.core.alert.AlertLifecycleManager;
import com.outbreaksentinel.core.alert.JsonFileAlertStore;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.config.PipelineSettingsLoader;
import com.outbreaksentinel.core.narrative.HttpNarrativeAssistant;
import com.outbreaksentinel.core.narrative.TimeBoundedNarrator;
import com.outbreaksentinel.core.notify.LoggingNotificationChannel;
import com.outbreaksentinel.core.notify.NotificationChannel;
import com.outbreaksentinel.core.notify.NotificationDispatcher;
import com.outbreaksentinel.core.notify.RecipientDirectory;
import com.outbreaksentinel.core.notify.WebhookNotificationChannel;
import com.outbreaksentinel.core.runner.CellProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the core services from {@link JobConfig} and {@link PipelineSettings}.
 *
 * <p>
 * The object itself is {@link Serializable} and carries only configuration,
 * so it can be shipped to Flink task managers; every JVM builds its own
 * services lazily on first use. All instances share the same file-backed
 * alert store directory. Cells are keyed by location, so one location is
 * only ever materialized by one instance at a time; the store's
 * compare-and-set writes order those against status changes made through
 * the control server.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineComponents implements Serializable, AutoCloseable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(PipelineComponents.class);

    private final JobConfig config;
    private final PipelineSettings settings;

    private transient AlertLifecycleManager lifecycle;
    private transient CellProcessor processor;
    private transient KafkaNotificationChannel kafkaChannel;
    private transient ExecutorService narrativeExecutor;

    public PipelineComponents(JobConfig config, PipelineSettings settings) {
        this.config = Objects.requireNonNull(config, "JobConfig must not be null");
        this.settings = Objects.requireNonNull(settings, "PipelineSettings must not be null");
    }

    /**
     * Resolve pipeline settings the way {@link JobConfig} says and wire
     * components around them.
     */
    public static PipelineComponents load(JobConfig config) {
        String path = config.getPipelineConfigPath();
        PipelineSettings settings = (path != null && !path.isBlank())
                ? PipelineSettingsLoader.fromFile(path)
                : PipelineSettingsLoader.load();
        return new PipelineComponents(config, settings);
    }

    public synchronized AlertLifecycleManager lifecycle() {
        if (lifecycle == null) {
            lifecycle = new AlertLifecycleManager(new JsonFileAlertStore(Path.of(config.getAlertStoreDir())),
                    Clock.systemUTC(), settings.getLifecycle());
        }
        return lifecycle;
    }

    public synchronized CellProcessor processor() {
        if (processor == null) {
            NotificationDispatcher dispatcher = new NotificationDispatcher(channels(),
                    new RecipientDirectory(settings.getRecipients()), lifecycle(), Clock.systemUTC());
            processor = CellProcessor.fromSettings(settings, narrator(), lifecycle(), dispatcher);
        }
        return processor;
    }

    private List<NotificationChannel> channels() {
        List<NotificationChannel> channels = new ArrayList<>();
        channels.add(new LoggingNotificationChannel());
        channels.add(new WebhookNotificationChannel(Duration.ofMillis(config.getNotificationTimeoutMs())));
        if (config.isKafkaEnabled()) {
            kafkaChannel = new KafkaNotificationChannel(config);
            channels.add(kafkaChannel);
        } else {
            LOG.info("KAFKA_BOOTSTRAP_SERVERS not set, kafka notification channel disabled");
        }
        return channels;
    }

    private TimeBoundedNarrator narrator() {
        long timeoutMs = config.getNarrativeTimeoutMs() > 0
                ? config.getNarrativeTimeoutMs()
                : settings.getEscalation().getNarrativeTimeoutMs();
        if (!config.isNarrativeEnabled()) {
            LOG.info("NARRATIVE_ENDPOINT not set, escalation rationale stays numeric-only");
            return TimeBoundedNarrator.numericOnly();
        }
        Duration timeout = Duration.ofMillis(timeoutMs);
        narrativeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "narrative-assistant");
            t.setDaemon(true);
            return t;
        });
        HttpNarrativeAssistant assistant = new HttpNarrativeAssistant(URI.create(config.getNarrativeEndpoint()),
                config.getNarrativeApiKey(), config.getNarrativeModel(), timeout);
        return new TimeBoundedNarrator(assistant, timeout, narrativeExecutor);
    }

    public JobConfig getConfig() {
        return config;
    }

    public PipelineSettings getSettings() {
        return settings;
    }

    @Override
    public synchronized void close() {
        if (kafkaChannel != null) {
            kafkaChannel.close();
            kafkaChannel = null;
        }
        if (narrativeExecutor != null) {
            narrativeExecutor.shutdownNow();
            narrativeExecutor = null;
        }
        processor = null;
    }

    /** Whether a Kafka producer or narrative pool is currently open. */
    synchronized boolean holdsResources() {
        return kafkaChannel != null || narrativeExecutor != null;
    }
}
