package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.MetricCell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.TestCells.cell;
import static com.outbreaksentinel.core.TestCells.quietHistory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BaselineStore} and {@link BaselineSnapshot}.
 */
class BaselineStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-16T02:00:00Z");

    @Test
    @DisplayName("Should give each cell only the prior days inside its lookback")
    void lookbackWindow() {
        List<MetricCell> cells = new ArrayList<>(quietHistory("district-7", TODAY, 20));
        MetricCell today = cell("district-7", TODAY, 40, 60);
        cells.add(today);
        BaselineStore store = new BaselineStore(new InMemoryCellRepository(cells), 7);

        BaselineSnapshot snapshot = store.snapshot(List.of(today), NOW);
        LocationBaseline baseline = snapshot.baselineFor("district-7", TODAY);

        assertThat(baseline.size()).isEqualTo(7);
        assertThat(baseline.getPriorCells()).extracting(MetricCell::getTimeBucket)
                .allMatch(d -> !d.isBefore(TODAY.minusDays(7)) && d.isBefore(TODAY));
        assertThat(snapshot.getTakenAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should cover the lookback of every pending cell of a location")
    void coversAllPendingCells() {
        List<MetricCell> cells = new ArrayList<>(quietHistory("district-7", TODAY, 20));
        MetricCell yesterday = cell("district-7", TODAY.minusDays(1), 35, 50);
        MetricCell today = cell("district-7", TODAY, 40, 60);
        BaselineStore store = new BaselineStore(new InMemoryCellRepository(cells), 7);

        BaselineSnapshot snapshot = store.snapshot(List.of(today, yesterday), NOW);

        assertThat(snapshot.baselineFor("district-7", TODAY.minusDays(1)).size()).isEqualTo(7);
        assertThat(snapshot.baselineFor("district-7", TODAY).size()).isEqualTo(7);
        assertThat(snapshot.locationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return an empty baseline for unknown locations")
    void unknownLocation() {
        BaselineSnapshot snapshot = BaselineSnapshot.empty(NOW, 14);

        assertThat(snapshot.baselineFor("nowhere", TODAY).size()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-positive lookback")
    void rejectsBadLookback() {
        assertThatThrownBy(() -> new BaselineStore(new InMemoryCellRepository(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
