package com.outbreaksentinel.core.runner;

import java.util.List;

/**
 * Processes the cells of one run. Cells of different locations may run in
 * parallel; cells of one location are processed by one worker in time-bucket
 * order.
 *
 * <p>
 * Implementations return one outcome per task and surface only
 * infrastructure failures as exceptions; per-cell failures are outcomes.
 * </p>
 */
public interface RunExecutor {

    List<CellOutcome> execute(List<CellTask> tasks, RunContext context) throws Exception;
}
