/**
 * Run orchestration: the per-cell processor, executors, the runner that
 * tracks the cursor and deferred cells, and the scheduler.
 */
package com.outbreaksentinel.core.runner;
