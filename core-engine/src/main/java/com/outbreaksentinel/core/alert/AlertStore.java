package com.outbreaksentinel.core.alert;

import com.outbreaksentinel.core.model.Alert;

import java.util.List;
import java.util.Optional;

/**
 * Narrow persistence contract for alerts.
 *
 * <p>
 * Writes are compare-and-set on {@link Alert#getVersion()}: {@link #insert}
 * stores version 1 and fails if the id exists, {@link #replace} succeeds only
 * if the stored version still equals {@code expectedVersion} and bumps it.
 * Reads return copies; mutating them never changes stored state.
 * </p>
 *
 * <p>
 * Every method throws {@link AlertStoreException} when the store fails. Only
 * {@link AlertLifecycleManager} writes through this interface.
 * </p>
 */
public interface AlertStore {

    Optional<Alert> findById(String alertId);

    /**
     * @return every alert for the location, any status
     */
    List<Alert> findByLocation(String location);

    /**
     * @return the location's active and acknowledged alerts
     */
    default List<Alert> findOpenByLocation(String location) {
        return findByLocation(location).stream().filter(Alert::isOpen).toList();
    }

    /**
     * @param alert new alert; its version is ignored
     * @return {@code false} if an alert with the same id already exists
     */
    boolean insert(Alert alert);

    /**
     * @param alert           updated alert
     * @param expectedVersion version the caller read
     * @return {@code false} if the alert is missing or was changed concurrently
     */
    boolean replace(Alert alert, long expectedVersion);
}
