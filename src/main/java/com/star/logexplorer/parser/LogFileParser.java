package com.star.logexplorer.parser;

import com.star.logexplorer.entity.LogEntry;
import com.star.logexplorer.processor.LogFileReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses one log file into complete entries: reads it fully, detects the
 * dialect from the first lines and runs the lines through an
 * {@link EntryAssembler}.
 *
 * <p>Missing, empty and unreadable files produce an empty list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogFileParser {

    private final LogFormatDetector formatDetector;
    private final LogLineParser lineParser;
    private final LogFileReader fileReader;

    public List<LogEntry> parseFile(Path filePath) {
        if (filePath == null || !Files.exists(filePath)) {
            log.warn("File does not exist: {}", filePath);
            return List.of();
        }
        if (!fileReader.isReadable(filePath)) {
            log.warn("File is not a readable regular file: {}", filePath);
            return List.of();
        }

        try {
            List<String> lines = fileReader.readLines(filePath);
            if (lines.isEmpty()) {
                log.warn("File is empty: {}", filePath);
                return List.of();
            }

            LogFormat format = formatDetector.detectFormat(
                    lines.subList(0, Math.min(lines.size(), LogFormatDetector.SAMPLE_LINES)));

            List<LogEntry> entries = parseLines(lines, format);
            log.debug("Parsed {} entries from {} using {} format", entries.size(), filePath, format);
            return entries;

        } catch (IOException | RuntimeException e) {
            log.warn("Error parsing log file: {}", filePath, e);
            return List.of();
        }
    }

    public List<LogEntry> parseLines(List<String> lines, LogFormat format) {
        EntryAssembler assembler = new EntryAssembler(format, lineParser);
        for (String line : lines) {
            assembler.accept(line);
        }
        return assembler.finish();
    }
}
