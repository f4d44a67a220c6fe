/**
 * Detector scorers, per-detector normalizers and the engine that turns a
 * {@link com.outbreaksentinel.core.model.MetricCell} into a
 * {@link com.outbreaksentinel.core.model.ScoreVector}.
 *
 * <p>
 * Everything here is pure computation over the cell and a read-only
 * {@link com.outbreaksentinel.core.baseline.LocationBaseline}.
 * </p>
 */
package com.outbreaksentinel.core.scoring;
