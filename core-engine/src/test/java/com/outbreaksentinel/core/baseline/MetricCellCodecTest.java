package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.MetricCell;
import com.outbreaksentinel.core.model.SourceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static com.outbreaksentinel.core.TestCells.TODAY;
import static com.outbreaksentinel.core.TestCells.cell;
import static com.outbreaksentinel.core.TestCells.withEnvironment;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MetricCellCodec}.
 */
class MetricCellCodecTest {

    private final MetricCellCodec codec = new MetricCellCodec();

    @Test
    @DisplayName("Should decode a cell written by the ingestion side")
    void decodesIngestedLine() {
        String line = "{\"location\":\"district-7\",\"timeBucket\":\"2024-03-15\",\"hospitalEvents\":30,"
                + "\"symptomCounts\":{\"fever\":20,\"cough\":10},\"socialMentions\":45,"
                + "\"keywordCounts\":{\"dengue\":45},"
                + "\"environment\":{\"vectorIndex\":7.5,\"rainfallMm\":60.0,\"humidityPct\":70.0,\"temperatureC\":28.0},"
                + "\"modelOutputs\":{\"iforest\":0.9},"
                + "\"sources\":[\"hospital\",\"social\",\"environment\"],\"ingestedBy\":\"collector-2\"}";

        Optional<MetricCell> decoded = codec.decode(line);

        assertThat(decoded).isPresent();
        MetricCell cell = decoded.get();
        assertThat(cell.getLocation()).isEqualTo("district-7");
        assertThat(cell.getTimeBucket()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(cell.getHospitalEvents()).isEqualTo(30);
        assertThat(cell.getSymptomCounts()).containsEntry("cough", 10);
        assertThat(cell.getEnvironment().getVectorIndex()).isEqualTo(7.5);
        assertThat(cell.getModelOutputs()).containsEntry("iforest", 0.9);
        assertThat(cell.getSources()).containsExactlyInAnyOrder(
                SourceCategory.HOSPITAL, SourceCategory.SOCIAL, SourceCategory.ENVIRONMENT);
    }

    @Test
    @DisplayName("Should read back what it writes")
    void encodeThenDecode() {
        MetricCell original = withEnvironment(cell("district-7", TODAY, 30, 45), 7.5, 60, 70, 28);

        String line = codec.encode(original);

        assertThat(line).contains("\"timeBucket\":\"2024-03-15\"").contains("\"environment\"");
        assertThat(codec.decode(line)).contains(original);
    }

    @Test
    @DisplayName("Should drop blank and malformed lines")
    void dropsBadLines() {
        assertThat(codec.decode("")).isEmpty();
        assertThat(codec.decode(null)).isEmpty();
        assertThat(codec.decode("{\"location\":")).isEmpty();
        assertThat(codec.decode("{\"location\":\"x\",\"timeBucket\":\"not-a-date\"}")).isEmpty();
    }
}
