package com.outbreaksentinel.flink;

import com.outbreaksentinel.core.runner.CellOutcome;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for Outbreak Sentinel.
 * <p>
 * Flink exposes these via its configured metric reporters (e.g. Prometheus).
 * The metric reporter is configured in {@code flink-conf.yaml} at cluster
 * level; the job only defines the metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code cells_scored_total} – cells that produced a fusion result</li>
 *   <li>{@code cases_escalated_total}, {@code cases_suppressed_total},
 *       {@code cases_deferred_total} – validation outcomes</li>
 *   <li>{@code cells_failed_total} – cells that failed processing</li>
 *   <li>{@code cell_latency_ms} – histogram of per-cell latency</li>
 * </ul>
 */
public class PipelineMetrics {

    private final Counter cellsScored;
    private final Counter casesEscalated;
    private final Counter casesSuppressed;
    private final Counter casesDeferred;
    private final Counter cellsFailed;
    private final Histogram cellLatency;

    public PipelineMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("outbreak_sentinel");

        this.cellsScored = group.counter("cells_scored_total");
        this.casesEscalated = group.counter("cases_escalated_total");
        this.casesSuppressed = group.counter("cases_suppressed_total");
        this.casesDeferred = group.counter("cases_deferred_total");
        this.cellsFailed = group.counter("cells_failed_total");
        this.cellLatency = group.histogram("cell_latency_ms", new DescriptiveStatisticsHistogram(350));
    }

    public void record(CellOutcome outcome, long latencyMs) {
        switch (outcome.getKind()) {
            case FAILED -> cellsFailed.inc();
            case ESCALATED -> {
                cellsScored.inc();
                casesEscalated.inc();
            }
            case SUPPRESSED -> {
                cellsScored.inc();
                casesSuppressed.inc();
            }
            case DEFERRED -> {
                cellsScored.inc();
                casesDeferred.inc();
            }
            case SCREENED_OUT -> cellsScored.inc();
            default -> throw new IllegalStateException("Unhandled outcome " + outcome.getKind());
        }
        cellLatency.update(latencyMs);
    }
}
