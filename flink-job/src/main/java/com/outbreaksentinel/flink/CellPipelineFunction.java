package com.outbreaksentinel.flink;

import com.outbreaksentinel.core.runner.CellOutcome;
import com.outbreaksentinel.core.runner.CellProcessor;
import com.outbreaksentinel.core.runner.CellTask;
import com.outbreaksentinel.core.runner.RunContext;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Flink {@link KeyedProcessFunction} that runs one run's cells through the
 * {@link CellProcessor}, keyed by location.
 *
 * <p>
 * Keying by location sends every cell of a location to the same subtask, in
 * time-bucket order, while different locations are processed in parallel.
 * No keyed state is kept: the run context (baseline snapshot, run id) is
 * shipped with the function and alerts live in the shared alert store.
 * </p>
 *
 * <h3>Metrics</h3>
 * <p>
 * Custom Flink metrics are registered in {@link #open(Configuration)} and
 * updated for every processed cell.
 * </p>
 *
 * @since 1.0.0
 */
public class CellPipelineFunction extends KeyedProcessFunction<String, CellTask, CellOutcome> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CellPipelineFunction.class);

    private final RunContext context;
    private final PipelineComponents components;

    private transient CellProcessor processor;
    private transient PipelineMetrics metrics;

    public CellPipelineFunction(RunContext context, PipelineComponents components) {
        this.context = Objects.requireNonNull(context, "RunContext must not be null");
        this.components = Objects.requireNonNull(components, "PipelineComponents must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        processor = components.processor();
        metrics = new PipelineMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("CellPipelineFunction opened for run {}", context.getRunId());
    }

    /**
     * Release the producer and narrative threads this subtask's copy of
     * {@link PipelineComponents} opened. Every run ships a fresh copy.
     */
    @Override
    public void close() {
        LOG.info("CellPipelineFunction closing for run {}", context.getRunId());
        processor = null;
        components.close();
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(CellTask task,
            KeyedProcessFunction<String, CellTask, CellOutcome>.Context ctx,
            Collector<CellOutcome> out) {
        long startNanos = System.nanoTime();

        CellOutcome outcome = processor.process(task, context);
        out.collect(outcome);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.record(outcome, durationMs);
    }
}
