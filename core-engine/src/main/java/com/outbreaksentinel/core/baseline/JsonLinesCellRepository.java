package com.outbreaksentinel.core.baseline;

import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.MetricCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CellSource} over a directory of {@code *.jsonl} files, one
 * {@link MetricCell} per line, as dropped by the aggregation job.
 *
 * <p>
 * The directory is re-read on every {@link #refresh()}, so a long-running
 * service sees newly delivered files on its next run. Files are read in name
 * order; a later line for the same key replaces an earlier one.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesCellRepository implements CellSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesCellRepository.class);

    private final Path directory;
    private final MetricCellCodec codec = new MetricCellCodec();
    private volatile InMemoryCellRepository cache = new InMemoryCellRepository();

    public JsonLinesCellRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /**
     * Re-read every file in the directory.
     *
     * @return number of cells loaded
     * @throws UncheckedIOException if the directory cannot be listed or read
     */
    @Override
    public synchronized int refresh() {
        InMemoryCellRepository loaded = new InMemoryCellRepository();
        if (!Files.isDirectory(directory)) {
            LOG.warn("Cell directory {} does not exist, no cells loaded", directory);
            cache = loaded;
            return 0;
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.jsonl")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list cell directory " + directory, e);
        }
        files.sort(null);

        int skipped = 0;
        for (Path file : files) {
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    Optional<MetricCell> cell = codec.decode(line);
                    if (cell.isPresent()) {
                        loaded.save(cell.get());
                    } else {
                        skipped++;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read cell file " + file, e);
            }
        }

        cache = loaded;
        LOG.info("Loaded {} cell(s) from {} file(s) in {} ({} malformed line(s) skipped)",
                loaded.size(), files.size(), directory, skipped);
        return loaded.size();
    }

    @Override
    public List<MetricCell> findAfter(LocalDate cursor) {
        return cache.findAfter(cursor);
    }

    @Override
    public List<MetricCell> findRange(String location, LocalDate fromInclusive, LocalDate toExclusive) {
        return cache.findRange(location, fromInclusive, toExclusive);
    }

    @Override
    public Optional<MetricCell> find(CellKey key) {
        return cache.find(key);
    }
}
