/**
 * Cell sources and the read-only historical baselines scorers run against.
 */
package com.outbreaksentinel.core.baseline;
