package com.outbreaksentinel.core.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.outbreaksentinel.core.model.CellKey;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * What a {@link PipelineRunner} must remember between passes and across
 * restarts: the cursor of the last pass, and for each recently seen cell the
 * fingerprint of the version processed and how often it was deferred.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunState {

    private LocalDate cursor;
    private List<TrackedCell> cells = new ArrayList<>();

    public LocalDate getCursor() {
        return cursor;
    }

    public void setCursor(LocalDate cursor) {
        this.cursor = cursor;
    }

    public List<TrackedCell> getCells() {
        return cells;
    }

    public void setCells(List<TrackedCell> cells) {
        this.cells = cells != null ? cells : new ArrayList<>();
    }

    /**
     * One cell's entry. {@code fingerprint} is {@code null} while the cell
     * still has to be processed; {@code deferrals} is 0 unless it is waiting
     * for more data.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrackedCell {

        private String location;
        private LocalDate timeBucket;
        private String fingerprint;
        private int deferrals;

        /** No-arg constructor required by Jackson. */
        public TrackedCell() {
        }

        public TrackedCell(CellKey key, String fingerprint, int deferrals) {
            this.location = key.getLocation();
            this.timeBucket = key.getTimeBucket();
            this.fingerprint = fingerprint;
            this.deferrals = deferrals;
        }

        @JsonIgnore
        public CellKey getKey() {
            return new CellKey(location, timeBucket);
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public LocalDate getTimeBucket() {
            return timeBucket;
        }

        public void setTimeBucket(LocalDate timeBucket) {
            this.timeBucket = timeBucket;
        }

        public String getFingerprint() {
            return fingerprint;
        }

        public void setFingerprint(String fingerprint) {
            this.fingerprint = fingerprint;
        }

        public int getDeferrals() {
            return deferrals;
        }

        public void setDeferrals(int deferrals) {
            this.deferrals = deferrals;
        }
    }
}
