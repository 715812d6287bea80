package com.cypher.guard.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RotatingFileAuditSink Tests")
class RotatingFileAuditSinkTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @TempDir
    Path directory;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /** Clock whose instant can be moved by tests. */
    private static final class MutableClock extends Clock {
        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }

    private AuditConfig.Builder config() {
        return AuditConfig.builder().directory(directory);
    }

    private static AuditEntry entry(String query) {
        return AuditEntry.builder()
                .timestamp(NOW)
                .operation("execute_cypher")
                .query(query)
                .sessionId("session-1")
                .build();
    }

    private List<String> logFiles() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Nested
    @DisplayName("File naming")
    class FileNaming {

        @Test
        @DisplayName("Should name daily files by date")
        void shouldNameDailyFiles() throws IOException {
            RotatingFileAuditSink sink = new RotatingFileAuditSink(config().build(),
                    Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());

            sink.append(entry("MATCH (n) RETURN n"));

            assertEquals(directory.resolve("audit_2024-03-15.log"), sink.currentFile());
            assertEquals(List.of("audit_2024-03-15.log"), logFiles());
        }

        @Test
        @DisplayName("Should name weekly files by ISO week")
        void shouldNameWeeklyFiles() throws IOException {
            RotatingFileAuditSink sink = new RotatingFileAuditSink(config().rotation(RotationPolicy.WEEKLY).build(),
                    Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());

            assertEquals(directory.resolve("audit_2024-W11.log"), sink.currentFile());
        }

        @Test
        @DisplayName("Should start a new file when the day changes")
        void shouldStartNewFileOnNewDay() throws IOException {
            MutableClock clock = new MutableClock(NOW);
            RotatingFileAuditSink sink = new RotatingFileAuditSink(config().build(), clock, new AuditRecordFormatter());

            sink.append(entry("MATCH (a) RETURN a"));
            clock.advance(Duration.ofDays(1));
            sink.append(entry("MATCH (b) RETURN b"));

            assertEquals(List.of("audit_2024-03-15.log", "audit_2024-03-16.log"), logFiles());
        }
    }

    @Nested
    @DisplayName("Record layout")
    class RecordLayout {

        @Test
        @DisplayName("Should write one JSON object per line")
        void shouldWriteJsonLines() throws IOException {
            RotatingFileAuditSink sink = new RotatingFileAuditSink(config().build(),
                    Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());

            sink.append(entry("MATCH (n)\nRETURN n"));
            sink.append(entry("MATCH (m) RETURN m"));

            List<String> lines = Files.readAllLines(sink.currentFile(), StandardCharsets.UTF_8);
            assertEquals(2, lines.size());
            JsonNode first = objectMapper.readTree(lines.get(0));
            assertEquals("MATCH (n)\nRETURN n", first.get("query").asText());
            assertEquals("execute_cypher", first.get("operation").asText());
        }

        @Test
        @DisplayName("Should separate text blocks with a blank line")
        void shouldWriteTextBlocks() throws IOException {
            RotatingFileAuditSink sink = new RotatingFileAuditSink(config().format(AuditFormat.TEXT).build(),
                    Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());

            sink.append(entry("MATCH (n) RETURN n"));
            sink.append(entry("MATCH (m) RETURN m"));

            String content = Files.readString(sink.currentFile(), StandardCharsets.UTF_8);
            assertEquals(2, content.split("\n\n").length);
            assertTrue(content.startsWith("[2024-03-15T10:00:00Z] QUERY - Operation: execute_cypher\n"));
        }
    }

    @Nested
    @DisplayName("Size rotation")
    class SizeRotation {

        @Test
        @DisplayName("Should archive the current file when the next record would exceed the limit")
        void shouldRotateBySize() throws IOException {
            RotatingFileAuditSink sink = new RotatingFileAuditSink(
                    config().rotation(RotationPolicy.SIZE).maxSizeMb(1).build(),
                    Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());
            String bigQuery = "RETURN '" + "x".repeat(400_000) + "'";

            sink.append(entry(bigQuery));
            sink.append(entry(bigQuery));
            sink.append(entry(bigQuery));

            assertEquals(List.of("audit_20240315_100000.log", RotatingFileAuditSink.CURRENT_FILE), logFiles());
            assertEquals(2, Files.readAllLines(directory.resolve("audit_20240315_100000.log")).size());
            assertEquals(1, Files.readAllLines(sink.currentFile()).size());
            assertTrue(Files.size(sink.currentFile()) <= AuditConfig.builder().maxSizeMb(1).build().maxSizeBytes());
        }

        @Test
        @DisplayName("Should add a suffix when an archive name is taken")
        void shouldSuffixArchiveNames() throws IOException {
            RotatingFileAuditSink sink = new RotatingFileAuditSink(
                    config().rotation(RotationPolicy.SIZE).maxSizeMb(1).build(),
                    Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());
            String hugeQuery = "RETURN '" + "x".repeat(700_000) + "'";

            sink.append(entry(hugeQuery));
            sink.append(entry(hugeQuery));
            sink.append(entry(hugeQuery));

            assertEquals(List.of("audit_20240315_100000.log", "audit_20240315_100000_1.log",
                    RotatingFileAuditSink.CURRENT_FILE), logFiles());
        }
    }

    @Nested
    @DisplayName("Retention")
    class Retention {

        @Test
        @DisplayName("Should delete audit files older than the retention period")
        void shouldPruneExpiredFiles() throws IOException {
            Path expired = Files.writeString(directory.resolve("audit_2023-11-01.log"), "old\n");
            Path recent = Files.writeString(directory.resolve("audit_2024-03-10.log"), "recent\n");
            Path unrelated = Files.writeString(directory.resolve("notes.txt"), "keep\n");
            Files.setLastModifiedTime(expired, FileTime.from(NOW.minus(Duration.ofDays(100))));
            Files.setLastModifiedTime(recent, FileTime.from(NOW.minus(Duration.ofDays(5))));
            Files.setLastModifiedTime(unrelated, FileTime.from(NOW.minus(Duration.ofDays(365))));

            new RotatingFileAuditSink(config().build(), Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());

            assertFalse(Files.exists(expired));
            assertTrue(Files.exists(recent));
            assertTrue(Files.exists(unrelated));
        }

        @Test
        @DisplayName("Should report how many files were pruned")
        void shouldCountPrunedFiles() throws IOException {
            MutableClock clock = new MutableClock(NOW);
            RotatingFileAuditSink sink = new RotatingFileAuditSink(config().retentionDays(7).build(),
                    clock, new AuditRecordFormatter());
            sink.append(entry("MATCH (n) RETURN n"));
            Files.setLastModifiedTime(sink.currentFile(), FileTime.from(NOW));

            clock.advance(Duration.ofDays(8));

            assertEquals(1, sink.pruneExpired());
            assertEquals(0, sink.pruneExpired());
        }
    }

    @Test
    @DisplayName("Should create the directory when missing")
    void shouldCreateDirectory() throws IOException {
        Path nested = directory.resolve("a").resolve("b");

        new RotatingFileAuditSink(AuditConfig.builder().directory(nested).build(),
                Clock.fixed(NOW, ZoneOffset.UTC), new AuditRecordFormatter());

        assertTrue(Files.isDirectory(nested));
    }
}
