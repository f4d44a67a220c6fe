package com.outbreaksentinel.flink;

import java.io.Serializable;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Typed, immutable configuration object for the Outbreak Sentinel service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * This makes the job fully configurable via Kubernetes Deployment env vars,
 * Docker {@code -e} flags, or a shell environment. Pipeline thresholds live
 * in the YAML pipeline settings, not here.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String MODE_FLINK = "flink";
    public static final String MODE_LOCAL = "local";

    // ---------------------------------------------------------------
    // Storage
    // ---------------------------------------------------------------
    private final String cellInputDir;
    private final String alertStoreDir;
    private final String runStatePath;
    private final String pipelineConfigPath;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final String executionMode;
    private final int parallelism;
    private final long scheduleIntervalSeconds;
    private final int initialLookbackDays;

    // ---------------------------------------------------------------
    // Control surface
    // ---------------------------------------------------------------
    private final int controlPort;

    // ---------------------------------------------------------------
    // Notifications
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaNotificationTopic;
    private final long notificationTimeoutMs;

    // ---------------------------------------------------------------
    // Narrative assistant
    // ---------------------------------------------------------------
    private final String narrativeEndpoint;
    private final String narrativeModel;
    private final String narrativeApiKey;
    private final long narrativeTimeoutMs;

    private JobConfig(Builder b) {
        this.cellInputDir = b.cellInputDir;
        this.alertStoreDir = b.alertStoreDir;
        this.runStatePath = b.runStatePath;
        this.pipelineConfigPath = b.pipelineConfigPath;
        this.executionMode = b.executionMode;
        this.parallelism = b.parallelism;
        this.scheduleIntervalSeconds = b.scheduleIntervalSeconds;
        this.initialLookbackDays = b.initialLookbackDays;
        this.controlPort = b.controlPort;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaNotificationTopic = b.kafkaNotificationTopic;
        this.notificationTimeoutMs = b.notificationTimeoutMs;
        this.narrativeEndpoint = b.narrativeEndpoint;
        this.narrativeModel = b.narrativeModel;
        this.narrativeApiKey = b.narrativeApiKey;
        this.narrativeTimeoutMs = b.narrativeTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .cellInputDir(env("CELL_INPUT_DIR", "data/cells"))
                    .alertStoreDir(env("ALERT_STORE_DIR", "data/alerts"))
                    .runStatePath(env("RUN_STATE_PATH", "data/run-state.json"))
                    .pipelineConfigPath(env("PIPELINE_CONFIG_PATH", ""))
                    .executionMode(env("EXECUTION_MODE", MODE_FLINK))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .scheduleIntervalSeconds(parseLongEnv("SCHEDULE_INTERVAL_SECONDS", "3600"))
                    .initialLookbackDays(parseIntEnv("INITIAL_LOOKBACK_DAYS", "7"))
                    .controlPort(parseIntEnv("CONTROL_PORT", "8080"))
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", ""))
                    .kafkaNotificationTopic(env("KAFKA_NOTIFICATION_TOPIC", "outbreak-notifications"))
                    .notificationTimeoutMs(parseLongEnv("NOTIFICATION_TIMEOUT_MS", "5000"))
                    .narrativeEndpoint(env("NARRATIVE_ENDPOINT", ""))
                    .narrativeModel(env("NARRATIVE_MODEL", "gpt-4o-mini"))
                    .narrativeApiKey(env("NARRATIVE_API_KEY", ""))
                    .narrativeTimeoutMs(parseLongEnv("NARRATIVE_TIMEOUT_MS", "0"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /** Kafka notifications are enabled only when bootstrap servers are set. */
    public boolean isKafkaEnabled() {
        return !kafkaBootstrapServers.isBlank();
    }

    /** Without an endpoint the escalation rationale stays numeric-only. */
    public boolean isNarrativeEnabled() {
        return !narrativeEndpoint.isBlank();
    }

    public boolean isFlinkMode() {
        return MODE_FLINK.equals(executionMode);
    }

    public Duration scheduleInterval() {
        return Duration.ofSeconds(scheduleIntervalSeconds);
    }

    /**
     * Build Kafka producer {@link Properties} for the notification channel.
     * Retries are bounded by the delivery timeout so a send never outlives
     * the dispatcher's wait.
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        props.setProperty("client.id", "outbreak-sentinel-notifier");
        props.setProperty("request.timeout.ms", String.valueOf(notificationTimeoutMs));
        props.setProperty("delivery.timeout.ms", String.valueOf(notificationTimeoutMs + 1_000));
        props.setProperty("max.block.ms", String.valueOf(notificationTimeoutMs));
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getCellInputDir() {
        return cellInputDir;
    }

    public String getAlertStoreDir() {
        return alertStoreDir;
    }

    /** JSON document holding the runner's cursor, processed cells and deferrals. */
    public String getRunStatePath() {
        return runStatePath;
    }

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    public String getExecutionMode() {
        return executionMode;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getScheduleIntervalSeconds() {
        return scheduleIntervalSeconds;
    }

    public int getInitialLookbackDays() {
        return initialLookbackDays;
    }

    public int getControlPort() {
        return controlPort;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaNotificationTopic() {
        return kafkaNotificationTopic;
    }

    public long getNotificationTimeoutMs() {
        return notificationTimeoutMs;
    }

    public String getNarrativeEndpoint() {
        return narrativeEndpoint;
    }

    public String getNarrativeModel() {
        return narrativeModel;
    }

    public String getNarrativeApiKey() {
        return narrativeApiKey;
    }

    /** {@code 0} means the pipeline settings' {@code narrativeTimeoutMs} applies. */
    public long getNarrativeTimeoutMs() {
        return narrativeTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, schedule interval &gt; 0, port in
     * [1, 65535], known execution mode, non-blank paths).
     * </p>
     */
    public static class Builder {
        private String cellInputDir = "data/cells";
        private String alertStoreDir = "data/alerts";
        private String runStatePath = "data/run-state.json";
        private String pipelineConfigPath = "";
        private String executionMode = MODE_FLINK;
        private int parallelism = 1;
        private long scheduleIntervalSeconds = 3_600;
        private int initialLookbackDays = 7;
        private int controlPort = 8080;
        private String kafkaBootstrapServers = "";
        private String kafkaNotificationTopic = "outbreak-notifications";
        private long notificationTimeoutMs = 5_000;
        private String narrativeEndpoint = "";
        private String narrativeModel = "gpt-4o-mini";
        private String narrativeApiKey = "";
        private long narrativeTimeoutMs;

        public Builder cellInputDir(String v) {
            this.cellInputDir = v;
            return this;
        }

        public Builder alertStoreDir(String v) {
            this.alertStoreDir = v;
            return this;
        }

        public Builder runStatePath(String v) {
            this.runStatePath = v;
            return this;
        }

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder executionMode(String v) {
            this.executionMode = v != null ? v.trim().toLowerCase(Locale.ROOT) : null;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder scheduleIntervalSeconds(long v) {
            this.scheduleIntervalSeconds = v;
            return this;
        }

        public Builder initialLookbackDays(int v) {
            this.initialLookbackDays = v;
            return this;
        }

        public Builder controlPort(int v) {
            this.controlPort = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaNotificationTopic(String v) {
            this.kafkaNotificationTopic = v;
            return this;
        }

        public Builder notificationTimeoutMs(long v) {
            this.notificationTimeoutMs = v;
            return this;
        }

        public Builder narrativeEndpoint(String v) {
            this.narrativeEndpoint = v;
            return this;
        }

        public Builder narrativeModel(String v) {
            this.narrativeModel = v;
            return this;
        }

        public Builder narrativeApiKey(String v) {
            this.narrativeApiKey = v;
            return this;
        }

        public Builder narrativeTimeoutMs(long v) {
            this.narrativeTimeoutMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(cellInputDir, "cellInputDir");
            requireNonBlank(alertStoreDir, "alertStoreDir");
            requireNonBlank(runStatePath, "runStatePath");
            requireNonBlank(kafkaNotificationTopic, "kafkaNotificationTopic");
            requireNonBlank(narrativeModel, "narrativeModel");
            Objects.requireNonNull(pipelineConfigPath, "pipelineConfigPath required (use \"\" for classpath)");
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required (use \"\" to disable)");
            Objects.requireNonNull(narrativeEndpoint, "narrativeEndpoint required (use \"\" to disable)");
            Objects.requireNonNull(narrativeApiKey, "narrativeApiKey required (use \"\" for none)");

            if (!MODE_FLINK.equals(executionMode) && !MODE_LOCAL.equals(executionMode)) {
                throw new IllegalArgumentException("executionMode must be '" + MODE_FLINK + "' or '"
                        + MODE_LOCAL + "', got: " + executionMode);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (scheduleIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "scheduleIntervalSeconds must be >= 1, got: " + scheduleIntervalSeconds);
            }
            if (initialLookbackDays < 0) {
                throw new IllegalArgumentException(
                        "initialLookbackDays must be >= 0, got: " + initialLookbackDays);
            }
            if (controlPort < 1 || controlPort > 65_535) {
                throw new IllegalArgumentException(
                        "controlPort must be in [1, 65535], got: " + controlPort);
            }
            if (notificationTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "notificationTimeoutMs must be >= 1, got: " + notificationTimeoutMs);
            }
            if (narrativeTimeoutMs < 0) {
                throw new IllegalArgumentException(
                        "narrativeTimeoutMs must be >= 0, got: " + narrativeTimeoutMs);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "cellInputDir='" + cellInputDir + '\'' +
                ", alertStoreDir='" + alertStoreDir + '\'' +
                ", runStatePath='" + runStatePath + '\'' +
                ", pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", executionMode='" + executionMode + '\'' +
                ", parallelism=" + parallelism +
                ", scheduleIntervalSeconds=" + scheduleIntervalSeconds +
                ", initialLookbackDays=" + initialLookbackDays +
                ", controlPort=" + controlPort +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaNotificationTopic='" + kafkaNotificationTopic + '\'' +
                ", narrativeEndpoint='" + narrativeEndpoint + '\'' +
                ", narrativeModel='" + narrativeModel + '\'' +
                ", narrativeApiKey=" + (narrativeApiKey.isBlank() ? "<none>" : "<redacted>") +
                '}';
    }
}
