package com.star.logexplorer.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the dialect of a file from its first lines. The first registered
 * format whose start-of-entry pattern matches any sampled line wins;
 * {@link LogFormat#STANDARD} is the fallback.
 */
@Component
@Slf4j
public class LogFormatDetector {

    public static final int SAMPLE_LINES = 10;

    public LogFormat detectFormat(List<String> sampleLines) {
        if (sampleLines == null || sampleLines.isEmpty()) {
            return LogFormat.STANDARD;
        }

        int limit = Math.min(sampleLines.size(), SAMPLE_LINES);
        for (String line : sampleLines.subList(0, limit)) {
            for (LogFormat format : LogFormat.values()) {
                if (format.isEntryStart(line)) {
                    log.debug("Detected {} format from line: {}", format, line);
                    return format;
                }
            }
        }

        log.debug("No format matched {} sample lines, using {}", limit, LogFormat.STANDARD);
        return LogFormat.STANDARD;
    }
}
