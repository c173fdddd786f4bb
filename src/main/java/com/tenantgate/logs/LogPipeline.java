package com.tenantgate.logs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantgate.core.metrics.TenantgateMetrics;
import com.tenantgate.sandbox.ExecResult;
import com.tenantgate.sandbox.Sandbox;
import com.tenantgate.storage.BlobObject;
import com.tenantgate.storage.BlobStore;
import com.tenantgate.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Moves one tenant's agent log out of its sandbox into blob storage.
 *
 * <p>New lines are read past a line offset, classified, and buffered; a full buffer
 * or an explicit {@link #flush} writes them as one NDJSON batch under
 * {@code logs/<tenant>/<yyyy-MM-dd>/<epochMillis>.ndjson}. Offset and buffer are
 * volatile: a crash before flush loses the buffered lines.
 * Not thread-safe; the owning controller serializes access.
 */
public class LogPipeline {

    private static final Logger log = LoggerFactory.getLogger(LogPipeline.class);

    private final BlobStore blobStore;
    private final LogProperties properties;
    private final String logFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TenantgateMetrics metrics;

    private final List<LogEntry> buffer = new ArrayList<>();
    private long offset;
    private long lastBatchStamp;

    public LogPipeline(BlobStore blobStore, LogProperties properties, String logFile,
                       ObjectMapper objectMapper, Clock clock, TenantgateMetrics metrics) {
        this.blobStore = blobStore;
        this.properties = properties;
        this.logFile = logFile;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Reads lines appended since the last pull. An unterminated trailing line is left
     * for the next pull so the offset only ever covers complete lines.
     *
     * @return number of lines consumed
     */
    public int pullAndBuffer(Sandbox sandbox, String tenantId) {
        ExecResult result = sandbox.exec("tail -n +" + (offset + 1) + " " + logFile + " 2>/dev/null");
        String output = result.stdout();
        if (output.isEmpty()) {
            return 0;
        }
        int end = output.lastIndexOf('\n');
        if (end < 0) {
            return 0;
        }
        String[] lines = output.substring(0, end).split("\n", -1);
        long now = clock.millis();
        for (String line : lines) {
            offset++;
            if (line.isBlank()) {
                continue;
            }
            buffer.add(new LogEntry(now, LogLevel.classify(line), line, tenantId));
            if (buffer.size() >= properties.getBufferCapacity()) {
                flush(tenantId);
            }
        }
        return lines.length;
    }

    /**
     * Writes the buffer as one batch. A failed write is logged and the batch dropped.
     */
    public void flush(String tenantId) {
        if (buffer.isEmpty()) {
            return;
        }
        var batch = List.copyOf(buffer);
        buffer.clear();

        // batches flushed within the same millisecond must not overwrite each other
        long stamp = Math.max(clock.millis(), lastBatchStamp + 1);
        lastBatchStamp = stamp;
        String key = tenantPrefix(tenantId) + LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC) + "/" + stamp + ".ndjson";
        try {
            var content = new StringBuilder();
            for (LogEntry entry : batch) {
                content.append(objectMapper.writeValueAsString(entry)).append('\n');
            }
            blobStore.put(key, content.toString(), Map.of(
                    "tenantId", tenantId,
                    "entryCount", String.valueOf(batch.size())));
            if (metrics != null) metrics.recordLogFlush(batch.size(), true);
            log.debug("Flushed {} log entries to {}", batch.size(), key);
        } catch (JsonProcessingException | StorageException e) {
            if (metrics != null) metrics.recordLogFlush(batch.size(), false);
            log.error("Failed to flush {} log entries for tenant {}, dropping batch: {}",
                    batch.size(), tenantId, e.getMessage());
        }
    }

    /**
     * Deletes batches whose date partition is older than the retention window.
     *
     * @return number of batches deleted
     */
    public int cleanupOld(String tenantId) {
        LocalDate cutoff = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC)
                .minusDays(properties.getRetentionDays());
        String prefix = tenantPrefix(tenantId);
        int deleted = 0;
        try {
            for (BlobObject object : blobStore.list(prefix)) {
                String rest = object.key().substring(prefix.length());
                int slash = rest.indexOf('/');
                if (slash < 0) {
                    continue;
                }
                try {
                    if (LocalDate.parse(rest.substring(0, slash)).isBefore(cutoff)) {
                        blobStore.delete(object.key());
                        deleted++;
                    }
                } catch (DateTimeParseException e) {
                    log.debug("Ignoring {}: not a dated log batch", object.key());
                }
            }
        } catch (StorageException e) {
            log.error("Log retention cleanup for tenant {} failed: {}", tenantId, e.getMessage());
        }
        if (deleted > 0) {
            log.info("Deleted {} log batches older than {} for tenant {}", deleted, cutoff, tenantId);
            if (metrics != null) metrics.recordLogRetentionDeletes(deleted);
        }
        return deleted;
    }

    /** Forgets the offset and buffer, e.g. after the sandbox is destroyed. */
    public void reset() {
        offset = 0;
        buffer.clear();
    }

    public long offset() {
        return offset;
    }

    public int buffered() {
        return buffer.size();
    }

    private String tenantPrefix(String tenantId) {
        return properties.getPrefix() + "/" + tenantId + "/";
    }
}
