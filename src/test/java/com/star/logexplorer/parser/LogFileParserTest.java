package com.star.logexplorer.parser;

import com.star.logexplorer.entity.LogEntry;
import com.star.logexplorer.entity.LogLevel;
import com.star.logexplorer.processor.LogFileReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogFileParserTest {

    @TempDir
    Path tempDir;

    private LogFileParser fileParser;

    @BeforeEach
    void setUp() {
        LogLineParser lineParser = new LogLineParser(ZoneOffset.UTC,
                Clock.fixed(Instant.parse("2030-06-01T12:00:00Z"), ZoneOffset.UTC));
        fileParser = new LogFileParser(new LogFormatDetector(), lineParser, new LogFileReader());
    }

    @Test
    @DisplayName("Should detect the dialect and assemble entries")
    void shouldParseNLogFile() throws IOException {
        Path file = tempDir.resolve("service.log");
        Files.writeString(file, String.join("\n",
                "2024-01-15 10:30:45,123 [Info] Service started",
                "2024-01-15 10:30:46,000 [Error] Request failed System.TimeoutException: upstream",
                "   at Http.Client.Send()",
                "2024-01-15 10:30:47,500 [Warn] Retrying",
                ""));

        List<LogEntry> entries = fileParser.parseFile(file);

        assertEquals(3, entries.size());
        assertEquals(LogLevel.INF, entries.get(0).getLevel());
        assertEquals(LogLevel.ERR, entries.get(1).getLevel());
        assertEquals("System.TimeoutException", entries.get(1).getExceptionType());
        assertEquals("   at Http.Client.Send()\n", entries.get(1).getStackTrace());
        assertEquals(Instant.parse("2024-01-15T10:30:47.500Z"), entries.get(2).getTimestamp());
    }

    @Test
    @DisplayName("Should handle CRLF line endings")
    void shouldParseCrlfFile() throws IOException {
        Path file = tempDir.resolve("windows.log");
        Files.writeString(file,
                "2024-01-15 10:30:45.123 [ERR] Failed\r\ndetail\r\n2024-01-15 10:30:46.000 [INF] Recovered\r\n",
                StandardCharsets.UTF_8);

        List<LogEntry> entries = fileParser.parseFile(file);

        assertEquals(2, entries.size());
        assertEquals("Failed\ndetail", entries.get(0).getMessage());
        assertEquals("Recovered", entries.get(1).getMessage());
    }

    @Test
    @DisplayName("Should return empty list for missing or empty files")
    void shouldReturnEmptyForMissingOrEmptyFile() throws IOException {
        Path empty = Files.createFile(tempDir.resolve("empty.log"));

        assertTrue(fileParser.parseFile(tempDir.resolve("missing.log")).isEmpty());
        assertTrue(fileParser.parseFile(empty).isEmpty());
        assertTrue(fileParser.parseFile(null).isEmpty());
    }

    @Test
    @DisplayName("Should return empty list when the path cannot be read as a file")
    void shouldReturnEmptyForDirectory() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("nested"));

        assertTrue(fileParser.parseFile(directory).isEmpty());
    }

    @Test
    @DisplayName("Should parse pre-split lines with a given format")
    void shouldParseLines() {
        List<LogEntry> entries = fileParser.parseLines(List.of(
                "2024-01-15 10:30:45 Error Payment declined",
                "2024-01-15 10:30:46 Information Payment retried"
        ), LogFormat.SERILOG);

        assertEquals(2, entries.size());
        assertEquals(LogLevel.ERR, entries.get(0).getLevel());
        assertEquals("Payment retried", entries.get(1).getMessage());
    }
}
