package com.outbreaksentinel.core.runner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RunStateStore} keeping the state as one JSON document. Writes go to
 * a temporary file in the same directory that is moved over the target
 * atomically.
 *
 * @since 1.0.0
 */
public class JsonFileRunStateStore implements RunStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileRunStateStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileRunStateStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath().normalize();
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<RunState> load() {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            LOG.info("No run state at {}, starting fresh", file);
            return Optional.empty();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read run state " + file, e);
        }
        try {
            RunState state = mapper.readValue(bytes, RunState.class);
            LOG.info("Loaded run state from {}: cursor {}, {} tracked cell(s)", file, state.getCursor(),
                    state.getCells().size());
            return Optional.of(state);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt run state " + file, e);
        }
    }

    @Override
    public void save(RunState state) {
        Objects.requireNonNull(state, "state must not be null");
        Path temp = null;
        try {
            Path directory = file.getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "run-state.", ".tmp");
            Files.write(temp, mapper.writeValueAsBytes(state));
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Saved run state to {}", file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new IllegalStateException("Failed to write run state " + file, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    public Path getFile() {
        return file;
    }
}
