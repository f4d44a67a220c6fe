/**
 * Weighted fusion of normalized detector scores into a composite score and
 * confidence per cell.
 */
package com.outbreaksentinel.core.fusion;
