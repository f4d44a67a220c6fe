package com.outbreaksentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Identity of a {@link MetricCell}: one location and one day-granularity
 * time bucket.
 *
 * @since 1.0.0
 */
public final class CellKey implements Serializable, Comparable<CellKey> {

    private static final long serialVersionUID = 1L;

    private final String location;
    private final LocalDate timeBucket;

    public CellKey(String location, LocalDate timeBucket) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.timeBucket = Objects.requireNonNull(timeBucket, "timeBucket must not be null");
    }

    public String getLocation() {
        return location;
    }

    public LocalDate getTimeBucket() {
        return timeBucket;
    }

    @Override
    public int compareTo(CellKey other) {
        int byLocation = location.compareTo(other.location);
        return byLocation != 0 ? byLocation : timeBucket.compareTo(other.timeBucket);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CellKey that))
            return false;
        return location.equals(that.location) && timeBucket.equals(that.timeBucket);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, timeBucket);
    }

    @Override
    public String toString() {
        return location + "@" + timeBucket;
    }
}
