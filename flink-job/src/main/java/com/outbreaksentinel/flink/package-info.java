/**
 * Apache Flink job and service shell for Outbreak Sentinel.
 *
 * <p>
 * This package wires the core pipeline into a long-running service: a
 * scheduler and an HTTP control surface start pipeline passes, and every
 * pass runs as a bounded Flink job that processes cells per location and
 * writes alerts through the lifecycle manager.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.outbreaksentinel.flink.OutbreakSentinelJob} — main entry
 * point</li>
 * <li>{@link com.outbreaksentinel.flink.FlinkRunExecutor} — one Flink batch
 * job per pass</li>
 * <li>{@link com.outbreaksentinel.flink.CellPipelineFunction} — keyed process
 * function</li>
 * <li>{@link com.outbreaksentinel.flink.KafkaNotificationChannel} — Kafka
 * notification channel</li>
 * <li>{@link com.outbreaksentinel.flink.JobConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.outbreaksentinel.flink.ControlServer} — health, run trigger,
 * run status and alert endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.outbreaksentinel.flink;
