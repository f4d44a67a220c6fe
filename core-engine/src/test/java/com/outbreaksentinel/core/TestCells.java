package com.outbreaksentinel.core;

import com.outbreaksentinel.core.model.EnvironmentReading;
import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cell builders shared by the core-engine tests.
 */
public final class TestCells {

    public static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private TestCells() {
        // utility class — not instantiable
    }

    /**
     * @return a cell with hospital and social data only
     */
    public static MetricCell cell(String location, LocalDate bucket, int hospital, int social) {
        return MetricCell.builder()
                .location(location)
                .timeBucket(bucket)
                .hospitalEvents(hospital)
                .symptomCounts(Map.of("fever", hospital))
                .socialMentions(social)
                .keywordCounts(Map.of("fever", social))
                .source(SourceCategory.HOSPITAL)
                .source(SourceCategory.SOCIAL)
                .build();
    }

    /**
     * @return a cell with hospital data only
     */
    public static MetricCell hospitalOnly(String location, LocalDate bucket, int hospital) {
        return MetricCell.builder()
                .location(location)
                .timeBucket(bucket)
                .hospitalEvents(hospital)
                .source(SourceCategory.HOSPITAL)
                .build();
    }

    /**
     * @return {@code cell} with an environment reading attached and flagged
     */
    public static MetricCell withEnvironment(MetricCell cell, double vectorIndex, double rainfall,
            double humidity, double temperature) {
        return cell.toBuilder()
                .environment(new EnvironmentReading(vectorIndex, rainfall, humidity, temperature))
                .source(SourceCategory.ENVIRONMENT)
                .build();
    }

    /**
     * Alternating quiet days ending the day before {@code bucket}, oldest first.
     *
     * @return {@code days} cells around 10 hospital events and 20 mentions a day
     */
    public static List<MetricCell> quietHistory(String location, LocalDate bucket, int days) {
        List<MetricCell> history = new ArrayList<>();
        for (int i = days; i >= 1; i--) {
            int wobble = i % 2 == 0 ? 1 : -1;
            history.add(cell(location, bucket.minusDays(i), 10 + wobble, 20 + wobble));
        }
        return history;
    }

    /**
     * Hospital-only history with an identical count every day, oldest first.
     */
    public static List<MetricCell> flatHospitalHistory(String location, LocalDate bucket, int days, int count) {
        List<MetricCell> history = new ArrayList<>();
        for (int i = days; i >= 1; i--) {
            history.add(hospitalOnly(location, bucket.minusDays(i), count));
        }
        return history;
    }
}
