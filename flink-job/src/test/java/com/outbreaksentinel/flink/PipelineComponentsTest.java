package com.outbreaksentinel.flink;

import com.outbreaksentinel.core.baseline.BaselineSnapshot;
import com.outbreaksentinel.core.config.PipelineSettings;
import com.outbreaksentinel.core.runner.LocalRunExecutor;
import com.outbreaksentinel.core.runner.RunContext;
import com.outbreaksentinel.core.runner.RunExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PipelineComponents} and executor selection in {@link OutbreakSentinelJob}.
 */
class PipelineComponentsTest {

    @TempDir
    Path dir;

    private JobConfig config(String mode) {
        return new JobConfig.Builder()
                .cellInputDir(dir.resolve("cells").toString())
                .alertStoreDir(dir.resolve("alerts").toString())
                .executionMode(mode)
                .build();
    }

    @Test
    @DisplayName("Should wire components once and reuse them")
    void memoizesComponents() {
        try (PipelineComponents components = new PipelineComponents(config(JobConfig.MODE_LOCAL),
                new PipelineSettings())) {
            assertThat(components.lifecycle()).isSameAs(components.lifecycle());
            assertThat(components.processor()).isSameAs(components.processor());
            assertThat(components.lifecycle().alertsForLocation("district-7")).isEmpty();
        }
    }

    @Test
    @DisplayName("Should execute runs in-process in local mode")
    void localExecutor() {
        JobConfig config = config(JobConfig.MODE_LOCAL);
        try (PipelineComponents components = new PipelineComponents(config, new PipelineSettings())) {
            RunExecutor executor = OutbreakSentinelJob.createExecutor(config, components);
            assertThat(executor).isInstanceOf(LocalRunExecutor.class);
            ((LocalRunExecutor) executor).close();
        }
    }

    @Test
    @DisplayName("Should execute runs as Flink jobs in flink mode")
    void flinkExecutor() {
        JobConfig config = config(JobConfig.MODE_FLINK);
        try (PipelineComponents components = new PipelineComponents(config, new PipelineSettings())) {
            assertThat(OutbreakSentinelJob.createExecutor(config, components)).isInstanceOf(FlinkRunExecutor.class);
        }
    }

    @Test
    @DisplayName("Should release the Kafka producer and narrative pool when the cell function closes")
    void cellFunctionCloseReleasesResources() {
        JobConfig config = new JobConfig.Builder()
                .cellInputDir(dir.resolve("cells").toString())
                .alertStoreDir(dir.resolve("alerts").toString())
                .kafkaBootstrapServers("127.0.0.1:9092")
                .notificationTimeoutMs(500)
                .narrativeEndpoint("http://127.0.0.1:9/v1/chat/completions")
                .build();
        PipelineComponents components = new PipelineComponents(config, new PipelineSettings());
        Instant now = Instant.parse("2024-03-15T23:30:00Z");
        CellPipelineFunction function = new CellPipelineFunction(
                new RunContext("run-1", now, BaselineSnapshot.empty(now, 14)), components);

        components.processor();
        assertThat(components.holdsResources()).isTrue();

        function.close();

        assertThat(components.holdsResources()).isFalse();
    }
}
