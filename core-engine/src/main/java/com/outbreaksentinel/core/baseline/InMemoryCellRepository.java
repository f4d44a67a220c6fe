package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.MetricCell;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory {@link CellSource}; {@link #save(MetricCell)} replaces
 * any cell with the same key.
 */
public class InMemoryCellRepository implements CellSource {

    private final ConcurrentMap<CellKey, MetricCell> cells = new ConcurrentHashMap<>();

    public InMemoryCellRepository() {
    }

    public InMemoryCellRepository(Collection<MetricCell> initial) {
        initial.forEach(this::save);
    }

    public void save(MetricCell cell) {
        Objects.requireNonNull(cell, "cell must not be null");
        cells.put(cell.getKey(), cell);
    }

    public int size() {
        return cells.size();
    }

    @Override
    public List<MetricCell> findAfter(LocalDate cursor) {
        return cells.values().stream()
                .filter(c -> cursor == null || c.getTimeBucket().isAfter(cursor))
                .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
                .toList();
    }

    @Override
    public List<MetricCell> findRange(String location, LocalDate fromInclusive, LocalDate toExclusive) {
        return cells.values().stream()
                .filter(c -> c.getLocation().equals(location))
                .filter(c -> !c.getTimeBucket().isBefore(fromInclusive) && c.getTimeBucket().isBefore(toExclusive))
                .sorted((a, b) -> a.getTimeBucket().compareTo(b.getTimeBucket()))
                .toList();
    }

    @Override
    public Optional<MetricCell> find(CellKey key) {
        return Optional.ofNullable(cells.get(key));
    }
}
