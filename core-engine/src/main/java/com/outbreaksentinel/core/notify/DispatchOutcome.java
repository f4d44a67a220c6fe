package com.outbreaksentinel.core.notify;

import java.util.List;
import java.util.Objects;

/**
 * Per-recipient results of one dispatch and whether the alert was marked
 * notified as a consequence.
 */
public final class DispatchOutcome {

    private final String alertId;
    private final List<DeliveryResult> results;
    private final boolean markedNotified;

    DispatchOutcome(String alertId, List<DeliveryResult> results, boolean markedNotified) {
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.results = List.copyOf(results);
        this.markedNotified = markedNotified;
    }

    public String getAlertId() {
        return alertId;
    }

    public List<DeliveryResult> getResults() {
        return results;
    }

    public boolean isMarkedNotified() {
        return markedNotified;
    }

    public boolean isDefinitive() {
        return !results.isEmpty() && results.stream().allMatch(DeliveryResult::isDefinitive);
    }

    public long count(DeliveryResult.Status status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    @Override
    public String toString() {
        return "DispatchOutcome{alertId='" + alertId + "', results=" + results
                + ", markedNotified=" + markedNotified + '}';
    }
}
