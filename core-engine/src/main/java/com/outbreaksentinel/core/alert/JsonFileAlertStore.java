package com.outbreaksentinel.core.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.outbreaksentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link AlertStore} keeping one JSON document per alert in a directory.
 *
 * <h3>Atomicity</h3>
 * <p>
 * Each write goes to a temporary file that is then moved over the target
 * with {@link StandardCopyOption#ATOMIC_MOVE}, so readers never see a
 * partially written alert. Compare-and-set writes hold a lock shared by every
 * store instance on the same directory in this JVM.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * I/O failures surface as transient {@link AlertStoreException}s; a document
 * that cannot be parsed is a permanent one.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileAlertStore.class);

    private static final ConcurrentMap<Path, ReentrantLock> DIRECTORY_LOCKS = new ConcurrentHashMap<>();

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final ReentrantLock lock;

    public JsonFileAlertStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath().normalize();
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.lock = DIRECTORY_LOCKS.computeIfAbsent(this.directory, d -> new ReentrantLock());
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new AlertStoreException("Cannot create alert directory " + this.directory, e, false);
        }
    }

    @Override
    public Optional<Alert> findById(String alertId) {
        return read(fileFor(alertId));
    }

    @Override
    public List<Alert> findByLocation(String location) {
        List<Alert> result = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                read(file).filter(a -> location.equals(a.getLocation())).ifPresent(result::add);
            }
        } catch (IOException e) {
            throw new AlertStoreException("Failed to list alert directory " + directory, e, true);
        }
        result.sort(Comparator.comparing(Alert::getCreatedAt).thenComparing(Alert::getAlertId));
        return result;
    }

    @Override
    public boolean insert(Alert alert) {
        Objects.requireNonNull(alert, "alert must not be null");
        return locked(() -> {
            Path target = fileFor(alert.getAlertId());
            if (Files.exists(target)) {
                return false;
            }
            write(target, alert.toBuilder().version(1).build());
            return true;
        });
    }

    @Override
    public boolean replace(Alert alert, long expectedVersion) {
        Objects.requireNonNull(alert, "alert must not be null");
        return locked(() -> {
            Path target = fileFor(alert.getAlertId());
            Optional<Alert> current = read(target);
            if (current.isEmpty() || current.get().getVersion() != expectedVersion) {
                return false;
            }
            write(target, alert.toBuilder().version(expectedVersion + 1).build());
            return true;
        });
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private Path fileFor(String alertId) {
        Objects.requireNonNull(alertId, "alertId must not be null");
        if (!alertId.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("Illegal alert id: " + alertId);
        }
        return directory.resolve(alertId + SUFFIX);
    }

    private Optional<Alert> read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new AlertStoreException("Failed to read alert file " + file, e, true);
        }
        try {
            return Optional.of(mapper.readValue(bytes, Alert.class));
        } catch (IOException e) {
            throw new AlertStoreException("Corrupt alert file " + file, e, false);
        }
    }

    private void write(Path target, Alert alert) {
        Path temp = null;
        try {
            byte[] json = mapper.writeValueAsBytes(alert);
            temp = Files.createTempFile(directory, alert.getAlertId() + ".", ".tmp");
            Files.write(temp, json);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Wrote alert {} version {}", alert.getAlertId(), alert.getVersion());
        } catch (JsonProcessingException e) {
            throw new AlertStoreException("Failed to encode alert " + alert.getAlertId(), e, false);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new AlertStoreException("Failed to write alert " + alert.getAlertId(), e, true);
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

    public Path getDirectory() {
        return directory;
    }
}
