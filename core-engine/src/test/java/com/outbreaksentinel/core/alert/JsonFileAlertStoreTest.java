package com.outbreaksentinel.core.alert;

import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.AlertStatus;
import com.outbreaksentinel.core.model.RecommendedAction;
import com.outbreaksentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileAlertStore}.
 */
class JsonFileAlertStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    @TempDir
    Path dir;

    private JsonFileAlertStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileAlertStore(dir);
    }

    private static Alert alert(String id, String location, Instant createdAt) {
        return Alert.builder()
                .alertId(id)
                .runId("run-1")
                .fusionResultId("fusion-" + id)
                .location(location)
                .timeBucket(DAY)
                .createdAt(createdAt)
                .anomalyScore(0.72)
                .confidence(0.6)
                .severity(Severity.HIGH)
                .evidence(Map.of("hospital", Map.of("total", 30)))
                .recommendedActions(List.of(
                        new RecommendedAction("medicine", "Stock antipyretics", "high", "pharmacies", "")))
                .status(AlertStatus.ACTIVE)
                .metadata(Map.of("merge_count", 0))
                .build();
    }

    @Test
    @DisplayName("Should persist an alert as version 1 and read it back")
    void insertAndRead() {
        Alert original = alert("a1", "district-7", Instant.parse("2024-03-15T06:00:00Z"));

        assertThat(store.insert(original)).isTrue();

        Alert read = store.findById("a1").orElseThrow();
        assertThat(read.getVersion()).isEqualTo(1);
        assertThat(read.getLocation()).isEqualTo("district-7");
        assertThat(read.getWindowStart()).isEqualTo(DAY);
        assertThat(read.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(read.getRecommendedActions()).containsExactlyElementsOf(original.getRecommendedActions());
        assertThat(read.getCreatedAt()).isEqualTo(original.getCreatedAt());
        assertThat(Files.exists(dir.resolve("a1.json"))).isTrue();
    }

    @Test
    @DisplayName("Should refuse to insert an existing id")
    void duplicateInsert() {
        Alert a = alert("a1", "district-7", Instant.parse("2024-03-15T06:00:00Z"));
        store.insert(a);

        assertThat(store.insert(a)).isFalse();
    }

    @Test
    @DisplayName("Should replace only when the expected version matches")
    void compareAndSet() {
        store.insert(alert("a1", "district-7", Instant.parse("2024-03-15T06:00:00Z")));
        Alert current = store.findById("a1").orElseThrow();
        Alert acknowledged = current.toBuilder().status(AlertStatus.ACKNOWLEDGED).build();

        assertThat(store.replace(acknowledged, 1)).isTrue();
        assertThat(store.replace(acknowledged, 1)).isFalse();
        assertThat(store.replace(alert("missing", "district-7", Instant.now()), 1)).isFalse();

        Alert stored = store.findById("a1").orElseThrow();
        assertThat(stored.getVersion()).isEqualTo(2);
        assertThat(stored.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
    }

    @Test
    @DisplayName("Should list a location's alerts oldest first")
    void findByLocation() {
        store.insert(alert("b2", "district-7", Instant.parse("2024-03-16T06:00:00Z")));
        store.insert(alert("a1", "district-7", Instant.parse("2024-03-15T06:00:00Z")));
        store.insert(alert("c3", "district-8", Instant.parse("2024-03-15T06:00:00Z")));

        assertThat(store.findByLocation("district-7")).extracting(Alert::getAlertId).containsExactly("a1", "b2");
        assertThat(store.findOpenByLocation("district-8")).hasSize(1);
        assertThat(store.findByLocation("district-9")).isEmpty();
    }

    @Test
    @DisplayName("Should see writes made through another instance on the same directory")
    void sharedDirectory() {
        new JsonFileAlertStore(dir).insert(alert("a1", "district-7", Instant.parse("2024-03-15T06:00:00Z")));

        assertThat(store.findById("a1")).isPresent();
    }

    @Test
    @DisplayName("Should report a corrupt document as a permanent failure")
    void corruptFile() throws IOException {
        Files.writeString(dir.resolve("bad.json"), "{not json");

        assertThatThrownBy(() -> store.findById("bad"))
                .isInstanceOf(AlertStoreException.class)
                .satisfies(e -> assertThat(((AlertStoreException) e).isTransient()).isFalse());
    }

    @Test
    @DisplayName("Should reject ids that are not safe file names")
    void illegalId() {
        assertThatThrownBy(() -> store.findById("../escape"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Illegal alert id");
    }
}
