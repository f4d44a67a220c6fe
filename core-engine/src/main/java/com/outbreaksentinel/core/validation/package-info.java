/**
 * The four-stage validation sequence that decides whether a screened cell
 * becomes an alert.
 *
 * <p>
 * {@link com.outbreaksentinel.core.validation.ValidationPipeline} runs
 * {@link com.outbreaksentinel.core.validation.DataIntegrityStage},
 * {@link com.outbreaksentinel.core.validation.CrossSourceVerificationStage},
 * {@link com.outbreaksentinel.core.validation.EnvironmentalRiskStage} and
 * {@link com.outbreaksentinel.core.validation.EscalationStage} in order over
 * an immutable {@link com.outbreaksentinel.core.validation.Case}. Verdicts
 * depend only on numeric thresholds from
 * {@link com.outbreaksentinel.core.config.PipelineSettings}.
 * </p>
 */
package com.outbreaksentinel.core.validation;
