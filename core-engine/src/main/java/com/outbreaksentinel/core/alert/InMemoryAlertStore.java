package com.outbreaksentinel.core.alert;

import com.outbreaksentinel.core.model.Alert;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe {@link AlertStore} held in memory.
 */
public class InMemoryAlertStore implements AlertStore {

    private final ConcurrentMap<String, Alert> alerts = new ConcurrentHashMap<>();

    @Override
    public Optional<Alert> findById(String alertId) {
        Alert alert = alerts.get(alertId);
        return alert == null ? Optional.empty() : Optional.of(alert.copy());
    }

    @Override
    public List<Alert> findByLocation(String location) {
        return alerts.values().stream()
                .filter(a -> a.getLocation().equals(location))
                .sorted(Comparator.comparing(Alert::getCreatedAt).thenComparing(Alert::getAlertId))
                .map(Alert::copy)
                .toList();
    }

    @Override
    public boolean insert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        Alert stored = alert.toBuilder().version(1).build();
        return alerts.putIfAbsent(stored.getAlertId(), stored) == null;
    }

    @Override
    public boolean replace(Alert alert, long expectedVersion) {
        Objects.requireNonNull(alert, "alert must not be null");
        boolean[] replaced = new boolean[1];
        alerts.computeIfPresent(alert.getAlertId(), (id, current) -> {
            if (current.getVersion() != expectedVersion) {
                return current;
            }
            replaced[0] = true;
            return alert.toBuilder().version(expectedVersion + 1).build();
        });
        return replaced[0];
    }

    public int size() {
        return alerts.size();
    }

    public List<Alert> findAll() {
        return alerts.values().stream().map(Alert::copy).toList();
    }
}
