package com.outbreaksentinel.core.runner;

import com.outbreaksentinel.core.model.CellKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileRunStateStore}.
 */
class JsonFileRunStateStoreTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should load nothing when no state has been written yet")
    void missingFile() {
        JsonFileRunStateStore store = new JsonFileRunStateStore(dir.resolve("run-state.json"));

        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("Should read back the cursor and tracked cells it saved")
    void savesAndLoads() {
        Path file = dir.resolve("nested").resolve("run-state.json");
        RunState state = new RunState();
        state.setCursor(DAY);
        state.setCells(List.of(
                new RunState.TrackedCell(new CellKey("district-7", DAY), "abc123", 0),
                new RunState.TrackedCell(new CellKey("district-5", DAY.minusDays(1)), null, 2)));

        new JsonFileRunStateStore(file).save(state);
        Optional<RunState> loaded = new JsonFileRunStateStore(file).load();

        assertThat(file).exists();
        assertThat(loaded).isPresent();
        assertThat(loaded.get().getCursor()).isEqualTo(DAY);
        assertThat(loaded.get().getCells()).hasSize(2);
        RunState.TrackedCell deferred = loaded.get().getCells().get(1);
        assertThat(deferred.getKey()).isEqualTo(new CellKey("district-5", DAY.minusDays(1)));
        assertThat(deferred.getFingerprint()).isNull();
        assertThat(deferred.getDeferrals()).isEqualTo(2);
        assertThat(loaded.get().getCells().get(0).getFingerprint()).isEqualTo("abc123");
    }

    @Test
    @DisplayName("Should replace the previous state on every save")
    void overwrites() {
        JsonFileRunStateStore store = new JsonFileRunStateStore(dir.resolve("run-state.json"));
        RunState first = new RunState();
        first.setCursor(DAY.minusDays(1));
        RunState second = new RunState();
        second.setCursor(DAY);

        store.save(first);
        store.save(second);

        assertThat(store.load()).get().extracting(RunState::getCursor).isEqualTo(DAY);
    }

    @Test
    @DisplayName("Should fail loudly on a corrupt state file")
    void corruptFile() throws IOException {
        Path file = dir.resolve("run-state.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new JsonFileRunStateStore(file).load())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Corrupt run state");
    }
}
