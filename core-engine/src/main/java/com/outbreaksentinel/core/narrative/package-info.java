/**
 * Optional natural-language rationale for escalated cases, always bounded
 * by a timeout and never consulted for verdicts.
 */
package com.outbreaksentinel.core.narrative;
