package com.star.logexplorer.processor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a whole log file into memory and splits it into lines.
 *
 * <p>Both {@code \n} and {@code \r\n} terminate a line. The empty segment
 * after a trailing newline is not reported as a line. A UTF-8 or UTF-16
 * byte order mark selects the charset and is stripped.
 */
@Component
@Slf4j
public class LogFileReader {

    private final Charset defaultCharset;

    public LogFileReader() {
        this(StandardCharsets.UTF_8);
    }

    public LogFileReader(Charset defaultCharset) {
        this.defaultCharset = defaultCharset;
    }

    public List<String> readLines(Path filePath) throws IOException {
        byte[] bytes = Files.readAllBytes(filePath);
        String content = decode(bytes);
        List<String> lines = splitLines(content);

        log.debug("Read {} lines ({} bytes) from {}", lines.size(), bytes.length, filePath);
        return lines;
    }

    public boolean isReadable(Path filePath) {
        return Files.isRegularFile(filePath) && Files.isReadable(filePath);
    }

    static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>();
        if (content.isEmpty()) {
            return lines;
        }

        int start = 0;
        int length = content.length();
        while (start < length) {
            int newline = content.indexOf('\n', start);
            if (newline < 0) {
                lines.add(content.substring(start));
                break;
            }
            int end = newline > start && content.charAt(newline - 1) == '\r' ? newline - 1 : newline;
            lines.add(content.substring(start, end));
            start = newline + 1;
        }
        return lines;
    }

    private String decode(byte[] bytes) {
        // Check for BOM markers
        if (bytes.length >= 3 &&
            bytes[0] == (byte) 0xEF &&
            bytes[1] == (byte) 0xBB &&
            bytes[2] == (byte) 0xBF) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }

        if (bytes.length >= 2) {
            if (bytes[0] == (byte) 0xFE && bytes[1] == (byte) 0xFF) {
                return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
            }
            if (bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xFE) {
                return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
            }
        }

        return new String(bytes, defaultCharset);
    }
}
