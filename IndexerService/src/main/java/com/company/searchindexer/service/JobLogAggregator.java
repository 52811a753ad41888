package com.company.searchindexer.service;

import com.company.searchindexer.config.IndexerProperties;
import common.indexer.dto.LogRecord;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Buffers en memoria con los últimos registros de log de cada proceso.
 * Altas y bajas de buffers van bajo un único cerrojo; las escrituras solo bloquean su propio buffer.
 */
@Slf4j
@Component
public class JobLogAggregator {

    private final int capacity;
    private final Clock clock;

    private final Map<Long, Buffer> buffers = new HashMap<>();

    @Autowired
    public JobLogAggregator(IndexerProperties properties, Clock clock) {
        this(properties.getLogBufferCapacity(), clock);
    }

    JobLogAggregator(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Log buffer capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * Logger de un proceso: escribe en {@code delegate} y en el buffer del proceso.
     */
    public JobLog open(Long jobId, Logger delegate) {
        bufferFor(jobId);
        return new JobLog(jobId, this, delegate);
    }

    public void append(Long jobId, String level, String message) {
        LogRecord record = new LogRecord(LocalDateTime.now(clock), level, message, jobId);
        bufferFor(jobId).add(record);
    }

    /**
     * Registros del proceso en orden de llegada. Con {@code since} devuelve solo los
     * estrictamente posteriores; si {@code since} no se puede interpretar devuelve todo.
     */
    public List<LogRecord> query(Long jobId, String since) {
        Buffer buffer;
        synchronized (buffers) {
            buffer = buffers.get(jobId);
        }
        if (buffer == null) {
            return List.of();
        }
        LocalDateTime after = parseSince(since);
        List<LogRecord> result = new ArrayList<>();
        for (LogRecord record : buffer.snapshot()) {
            if (after == null || record.getTimestamp().isAfter(after)) {
                result.add(record);
            }
        }
        return result;
    }

    public boolean remove(Long jobId) {
        synchronized (buffers) {
            return buffers.remove(jobId) != null;
        }
    }

    public Set<Long> bufferedJobIds() {
        synchronized (buffers) {
            return new TreeSet<>(buffers.keySet());
        }
    }

    private Buffer bufferFor(Long jobId) {
        synchronized (buffers) {
            return buffers.computeIfAbsent(jobId, id -> new Buffer(capacity));
        }
    }

    private LocalDateTime parseSince(String since) {
        if (since == null || since.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(since);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(since).atZoneSameInstant(clock.getZone()).toLocalDateTime();
            } catch (DateTimeParseException ignored) {
                log.warn("Valor 'since' no válido '{}', se devuelven todos los registros", since);
                return null;
            }
        }
    }

    private static final class Buffer {
        private final int capacity;
        private final Deque<LogRecord> records;

        Buffer(int capacity) {
            this.capacity = capacity;
            this.records = new ArrayDeque<>(Math.min(capacity, 1024));
        }

        synchronized void add(LogRecord record) {
            if (records.size() == capacity) {
                records.pollFirst();
            }
            records.addLast(record);
        }

        synchronized List<LogRecord> snapshot() {
            return new ArrayList<>(records);
        }
    }
}
