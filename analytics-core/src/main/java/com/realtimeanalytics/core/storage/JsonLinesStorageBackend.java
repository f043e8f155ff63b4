package com.realtimeanalytics.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.realtimeanalytics.core.baseline.BaselineStats;
import com.realtimeanalytics.core.model.Aggregation;
import com.realtimeanalytics.core.model.Granularity;
import com.realtimeanalytics.core.model.HistoryRow;
import com.realtimeanalytics.core.model.MetricKey;
import com.realtimeanalytics.core.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * File-backed {@link StorageBackend} that appends one JSON document per
 * aggregation.
 *
 * <h3>Format</h3>
 *
 * <pre>
 * {"metric":"api.latency","tags":{"route":"/a"},"count":3,"sum":30.0,...,"endTime":"2024-01-01T00:00:05Z"}
 * </pre>
 * <p>
 * Reads scan the whole file. Lines that cannot be parsed are logged and
 * skipped so one torn write does not hide the rest of the history.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All operations synchronize on the instance.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesStorageBackend implements StorageBackend {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesStorageBackend.class);

    private final Path file;
    private final ObjectMapper mapper;
    private BufferedWriter writer;
    private boolean closed;

    /**
     * Open (or create) the file for appending.
     *
     * @param file target file; parent directories are created
     * @throws StorageException if the file cannot be opened
     */
    public JsonLinesStorageBackend(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.writer = openWriter();
        LOG.info("Storing aggregations in {}", file);
    }

    @Override
    public synchronized void persistAggregation(MetricKey key, Aggregation aggregation) {
        ensureOpen();
        try {
            writer.write(mapper.writeValueAsString(StoredAggregation.from(key, aggregation)));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new StorageException("Failed to append aggregation for " + key + " to " + file, e);
        }
    }

    @Override
    public synchronized Map<MetricKey, BaselineStats> loadBaselineStats(Instant since) {
        ensureOpen();
        return AggregationHistory.rebuildBaselines(readAll(), since);
    }

    @Override
    public synchronized List<HistoryRow> queryHistory(String metricName, Map<String, String> tags,
            TimeRange range, Granularity granularity) {
        ensureOpen();
        return AggregationHistory.query(readAll(), metricName, tags, range, granularity);
    }

    @Override
    public synchronized int purgeBefore(Instant cutoff) {
        ensureOpen();
        List<AggregationRecord> records = readAll();
        List<AggregationRecord> kept = new ArrayList<>(records.size());
        for (AggregationRecord record : records) {
            if (!record.getAggregation().getEndTime().isBefore(cutoff)) {
                kept.add(record);
            }
        }
        int purged = records.size() - kept.size();
        if (purged == 0) {
            return 0;
        }

        closeWriter();
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            for (AggregationRecord record : kept) {
                out.write(mapper.writeValueAsString(
                        StoredAggregation.from(record.getKey(), record.getAggregation())));
                out.newLine();
            }
        } catch (IOException e) {
            writer = openWriter();
            throw new StorageException("Failed to rewrite " + file + " during purge", e);
        }
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to replace " + file + " during purge", e);
        } finally {
            writer = openWriter();
        }
        LOG.info("Purged {} aggregation(s) ending before {} from {}", purged, cutoff, file);
        return purged;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeWriter();
    }

    public Path getFile() {
        return file;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<AggregationRecord> readAll() {
        List<AggregationRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(mapper.readValue(line, StoredAggregation.class).toRecord());
                } catch (JsonProcessingException | RuntimeException e) {
                    LOG.warn("Skipping unreadable line {} of {}: {}", lineNo, file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file, e);
        }
        return records;
    }

    private BufferedWriter openWriter() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageException("Failed to open " + file + " for writing", e);
        }
    }

    private void closeWriter() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new StorageException("Failed to close " + file, e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Storage " + file + " is closed");
        }
    }
}
