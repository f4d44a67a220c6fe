package com.outbreaksentinel.flink;

import com.outbreaksentinel.core.runner.CellOutcome;
import com.outbreaksentinel.core.runner.CellTask;
import org.apache.flink.api.java.typeutils.runtime.kryo.JavaSerializer;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FlinkRunExecutor}.
 */
class FlinkRunExecutorTest {

    @Test
    @DisplayName("Should register cell tasks and outcomes with the Java serializer")
    void configuresEnvironment() {
        StreamExecutionEnvironment env = StreamExecutionEnvironment.createLocalEnvironment();

        FlinkRunExecutor.configure(env, 3);

        assertThat(env.getParallelism()).isEqualTo(3);
        assertThat(env.getConfig().getRegisteredTypesWithKryoSerializerClasses())
                .containsEntry(CellTask.class, (Class) JavaSerializer.class)
                .containsEntry(CellOutcome.class, (Class) JavaSerializer.class);
    }
}
