/**
 * YAML-backed pipeline configuration: thresholds, detector weights, the
 * recommended-action rule table and the recipient directory.
 *
 * <p>
 * Loaded once per process by
 * {@link com.outbreaksentinel.core.config.PipelineSettingsLoader} and
 * shared read-only across runs.
 * </p>
 */
package com.outbreaksentinel.core.config;
