package com.cypher.guard.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.Objects;

/**
 * Appends audit records to files in a directory, rotating by day, ISO week or size, and
 * deleting {@code audit_*.log} files older than the retention period.
 *
 * <p>Writes are serialized on this sink, so records from concurrent callers never interleave.
 * Retention is enforced on construction and whenever a new file is started.</p>
 */
public class RotatingFileAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(RotatingFileAuditSink.class);

    static final String CURRENT_FILE = "audit_current.log";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter ARCHIVE = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path directory;
    private final AuditFormat format;
    private final RotationPolicy rotation;
    private final long maxSizeBytes;
    private final AuditConfig config;
    private final Clock clock;
    private final AuditRecordFormatter formatter;
    private Path activeFile;

    public RotatingFileAuditSink(AuditConfig config) throws IOException {
        this(config, Clock.systemDefaultZone(), new AuditRecordFormatter());
    }

    public RotatingFileAuditSink(AuditConfig config, Clock clock, AuditRecordFormatter formatter) throws IOException {
        this.config = Objects.requireNonNull(config, "config is required");
        this.directory = config.directory();
        this.format = config.format();
        this.rotation = config.rotation();
        this.maxSizeBytes = config.maxSizeBytes();
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.formatter = Objects.requireNonNull(formatter, "formatter is required");
        Files.createDirectories(directory);
        pruneExpired();
        log.info("RotatingFileAuditSink initialized: directory={}, format={}, rotation={}",
                directory, format, rotation);
    }

    @Override
    public synchronized void append(AuditEntry entry) throws IOException {
        String record = formatter.format(entry, format) + (format == AuditFormat.TEXT ? "\n" : System.lineSeparator());
        byte[] bytes = record.getBytes(StandardCharsets.UTF_8);
        Path file = currentFile(bytes.length);
        Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /**
     * Name of the file that receives records right now.
     */
    synchronized Path currentFile() {
        return directory.resolve(fileName(LocalDate.now(clock)));
    }

    /**
     * Deletes audit files whose last modification is older than the retention period.
     *
     * @return number of files deleted
     */
    public synchronized int pruneExpired() throws IOException {
        Instant cutoff = clock.instant().minus(config.retention());
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "audit_*.log")) {
            for (Path file : files) {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    deleted++;
                }
            }
        }
        if (deleted > 0) {
            log.info("audit.pruned files={} retentionDays={}", deleted, config.retentionDays());
        }
        return deleted;
    }

    private Path currentFile(int incomingBytes) throws IOException {
        Path file = currentFile();
        if (activeFile != null && !file.equals(activeFile)) {
            pruneExpired();
        }
        if (rotation == RotationPolicy.SIZE && Files.exists(file)) {
            long size = Files.size(file);
            if (size > 0 && size + incomingBytes > maxSizeBytes) {
                Path archived = archiveName();
                Files.move(file, archived);
                log.info("audit.rotated archive={}", archived.getFileName());
                pruneExpired();
            }
        }
        activeFile = file;
        return file;
    }

    private Path archiveName() {
        String stamp = LocalDateTime.now(clock).format(ARCHIVE);
        Path archived = directory.resolve("audit_" + stamp + ".log");
        int suffix = 1;
        while (Files.exists(archived)) {
            archived = directory.resolve("audit_" + stamp + "_" + suffix++ + ".log");
        }
        return archived;
    }

    private String fileName(LocalDate date) {
        return switch (rotation) {
            case DAILY -> "audit_" + date.format(DAY) + ".log";
            case WEEKLY -> String.format("audit_%d-W%02d.log",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case SIZE -> CURRENT_FILE;
        };
    }
}
