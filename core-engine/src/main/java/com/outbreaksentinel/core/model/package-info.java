/**
 * Domain model classes for Outbreak Sentinel.
 *
 * <p>
 * Value types shared by scoring, fusion, validation, the alert lifecycle
 * and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.outbreaksentinel.core.model.MetricCell} — one (location, day)
 * aggregate of hospital, social and environmental data</li>
 * <li>{@link com.outbreaksentinel.core.model.ScoreVector} — every detector's
 * raw and normalized score for a cell</li>
 * <li>{@link com.outbreaksentinel.core.model.FusionResult} — composite score
 * and confidence</li>
 * <li>{@link com.outbreaksentinel.core.model.Alert} — persisted alert</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.outbreaksentinel.core.model;
