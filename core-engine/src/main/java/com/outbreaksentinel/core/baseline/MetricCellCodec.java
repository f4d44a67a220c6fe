package com.outbreaksentinel.core.baseline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.outbreaksentinel.core.model.ContentHash;
import com.outbreaksentinel.core.model.MetricCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts between {@link MetricCell} and one line of JSON.
 *
 * <p>
 * Malformed lines are logged and dropped, so a single bad record never fails
 * a whole file.
 * </p>
 */
public class MetricCellCodec {

    private static final Logger LOG = LoggerFactory.getLogger(MetricCellCodec.class);

    private final ObjectMapper mapper;

    public MetricCellCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param line one JSON document
     * @return the cell, or empty if the line is blank or malformed
     */
    public Optional<MetricCell> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(line, MetricCell.class));
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.warn("Failed to decode metric cell – skipping: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public String encode(MetricCell cell) {
        try {
            return mapper.writeValueAsString(cell);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode metric cell " + cell.getKey(), e);
        }
    }

    /**
     * Content hash of a cell, independent of map insertion order. Two
     * versions of the same cell have the same fingerprint only if every
     * count, reading and model output is equal.
     */
    public String fingerprint(MetricCell cell) {
        try {
            return ContentHash.sha256(mapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(cell));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to fingerprint metric cell " + cell.getKey(), e);
        }
    }
}
