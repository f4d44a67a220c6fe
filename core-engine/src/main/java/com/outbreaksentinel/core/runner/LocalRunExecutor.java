package com.outbreaksentinel.core.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process {@link RunExecutor} on a fixed thread pool, one task per
 * location.
 *
 * @since 1.0.0
 */
public class LocalRunExecutor implements RunExecutor, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(LocalRunExecutor.class);

    private final CellProcessor processor;
    private final ExecutorService pool;

    public LocalRunExecutor(CellProcessor processor, int parallelism) {
        this.processor = Objects.requireNonNull(processor, "CellProcessor must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "cell-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public List<CellOutcome> execute(List<CellTask> tasks, RunContext context) throws InterruptedException {
        Map<String, List<CellTask>> byLocation = new LinkedHashMap<>();
        for (CellTask task : tasks) {
            byLocation.computeIfAbsent(task.getCell().getLocation(), l -> new ArrayList<>()).add(task);
        }

        List<Future<List<CellOutcome>>> futures = new ArrayList<>();
        for (List<CellTask> locationTasks : byLocation.values()) {
            locationTasks.sort(Comparator.comparing(CellTask::getKey));
            futures.add(pool.submit(() -> {
                List<CellOutcome> outcomes = new ArrayList<>(locationTasks.size());
                for (CellTask task : locationTasks) {
                    outcomes.add(processor.process(task, context));
                }
                return outcomes;
            }));
        }
        LOG.debug("Run {}: {} cell(s) across {} location(s)", context.getRunId(), tasks.size(), byLocation.size());

        List<CellOutcome> all = new ArrayList<>(tasks.size());
        for (Future<List<CellOutcome>> future : futures) {
            try {
                all.addAll(future.get());
            } catch (ExecutionException e) {
                throw new IllegalStateException("Cell worker failed in run " + context.getRunId(), e.getCause());
            }
        }
        return all;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
