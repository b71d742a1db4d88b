package com.elssolution.energymonitor.store;

import com.elssolution.energymonitor.domain.AggregateFn;
import com.elssolution.energymonitor.domain.Reading;
import com.elssolution.energymonitor.domain.ReadingField;
import com.elssolution.energymonitor.domain.TimeRange;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.Set;

/**
 * Journals every reading as one JSON line and serves queries from an in-memory index.
 * The journal is replayed on startup, so history survives a restart.
 * A line is flushed before the reading becomes visible to readers.
 */
@Slf4j
public class JournalReadingStore implements ReadingStore, Closeable {

    private final Path file;
    private final ObjectMapper json;
    private final InMemoryReadingStore index = new InMemoryReadingStore();
    private final Object writeLock = new Object();
    private BufferedWriter out;

    public JournalReadingStore(Path file) throws IOException {
        this.file = file;
        this.json = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        int replayed = replay();
        this.out = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        log.info("reading_journal_opened path={} replayed={}", file, replayed);
    }

    private int replay() throws IOException {
        if (!Files.exists(file)) return 0;
        int n = 0;
        int skipped = 0;
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                try {
                    index.append(json.readValue(line, Reading.class));
                    n++;
                } catch (IOException | StoreWriteException e) {
                    // a torn last line after a crash, or a clock step backwards
                    skipped++;
                    log.warn("reading_journal_line_skipped path={} err={}", file, e.getMessage());
                }
            }
        }
        if (skipped > 0) log.warn("reading_journal_replay path={} ok={} skipped={}", file, n, skipped);
        return n;
    }

    @Override
    public void append(Reading r) {
        synchronized (writeLock) {
            index.ensureAppendable(r);
            if (out == null) throw new StoreWriteException("journal closed: " + file);
            try {
                out.write(json.writeValueAsString(r));
                out.newLine();
                out.flush();
            } catch (IOException e) {
                throw new StoreWriteException("journal write failed: " + file, e);
            }
            index.append(r);
        }
    }

    @Override
    public Iterable<Reading> query(String deviceId, TimeRange range) {
        return index.query(deviceId, range);
    }

    @Override
    public double aggregate(String deviceId, TimeRange range, AggregateFn fn, ReadingField field) {
        return index.aggregate(deviceId, range, fn, field);
    }

    @Override
    public Optional<Reading> latest(String deviceId) {
        return index.latest(deviceId);
    }

    @Override
    public Set<String> deviceIds() {
        return index.deviceIds();
    }

    @Override
    public void close() throws IOException {
        synchronized (writeLock) {
            if (out != null) {
                out.close();
                out = null;
                log.info("reading_journal_closed path={}", file);
            }
        }
    }
}
