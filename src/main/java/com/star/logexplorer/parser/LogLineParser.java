package com.star.logexplorer.parser;

import com.star.logexplorer.config.LogExplorerProperties;
import com.star.logexplorer.entity.LogEntry;
import com.star.logexplorer.entity.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a single header line into a {@link LogEntry}.
 *
 * <p>The parser never fails. Lines the dialect's parse pattern does not
 * match keep the raw line as message, {@link LogLevel#INF} as level and
 * the current instant as timestamp. Timestamps that cannot be read fall
 * back to the current instant while the other fields are kept.
 *
 * <p>Messages mentioning {@code Exception} are scanned for a dotted
 * exception type ({@code System.NullReferenceException:}) and a .NET style
 * source reference ({@code in C:\src\Foo.cs:line 42}).
 *
 * @author LogScanner Team
 */
@Component
@Slf4j
public class LogLineParser {

    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");

    private static final Pattern OFFSET_TIMESTAMP = Pattern.compile(
            "^(?<dateTime>\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}(?:\\.\\d{3})?) (?<offset>[+-]\\d{2}:\\d{2})$"
    );

    private static final Pattern EXCEPTION_TYPE = Pattern.compile("(\\w+\\.\\w+Exception):");

    private static final Pattern SOURCE_REFERENCE = Pattern.compile("in (.*\\.\\w+):line \\d+");

    private final ZoneId zone;
    private final Clock clock;

    @Autowired
    public LogLineParser(LogExplorerProperties properties) {
        this(properties.getZoneId(), Clock.systemUTC());
    }

    public LogLineParser(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.clock = clock;
    }

    public LogEntry parseHeaderLine(String line, LogFormat format) {
        return parse(line, format).getEntry();
    }

    public ParseResult parse(String line, LogFormat format) {
        String rawLine = line != null ? line : "";
        LogFormat effectiveFormat = format != null ? format : LogFormat.STANDARD;

        LogEntry entry = LogEntry.builder()
                .timestamp(clock.instant())
                .level(LogLevel.INF)
                .message(rawLine)
                .build();

        try {
            Matcher matcher = effectiveFormat.getParsePattern().matcher(rawLine);
            if (!matcher.find()) {
                return ParseResult.defaulted(entry, effectiveFormat, rawLine, "No parse pattern match");
            }

            String reason = null;

            Instant timestamp = parseTimestamp(matcher.group("timestamp"), effectiveFormat);
            if (timestamp != null) {
                entry.setTimestamp(timestamp);
            } else {
                reason = "Unparseable timestamp '" + matcher.group("timestamp") + "'";
            }

            entry.setLevel(LogLevel.normalize(matcher.group("level")));

            String message = matcher.group("message") != null ? matcher.group("message").trim() : "";
            if (!message.isEmpty()) {
                entry.setMessage(message);
            } else {
                reason = reason != null ? reason + "; empty message" : "Empty message";
            }

            extractExceptionDetails(entry);

            return reason == null
                    ? ParseResult.parsed(entry, effectiveFormat, rawLine)
                    : ParseResult.defaulted(entry, effectiveFormat, rawLine, reason);

        } catch (RuntimeException e) {
            log.debug("Failed to parse {} line '{}': {}", effectiveFormat, rawLine, e.getMessage());
            return ParseResult.defaulted(entry, effectiveFormat, rawLine, e.getMessage());
        }
    }

    Instant parseTimestamp(String timestampStr, LogFormat format) {
        if (timestampStr == null || timestampStr.isBlank()) {
            return null;
        }

        String normalized = timestampStr.trim().replaceAll("\\s+", " ");
        if (format.usesDecimalComma()) {
            normalized = normalized.replace(',', '.');
        }

        try {
            Matcher offsetMatcher = OFFSET_TIMESTAMP.matcher(normalized);
            if (offsetMatcher.matches()) {
                LocalDateTime dateTime = LocalDateTime.parse(offsetMatcher.group("dateTime"), TIMESTAMP_FORMATTER);
                return dateTime.toInstant(ZoneOffset.of(offsetMatcher.group("offset")));
            }
            return LocalDateTime.parse(normalized, TIMESTAMP_FORMATTER).atZone(zone).toInstant();
        } catch (DateTimeException e) {
            log.debug("Could not parse timestamp: '{}', using current time", timestampStr);
            return null;
        }
    }

    private void extractExceptionDetails(LogEntry entry) {
        String message = entry.getMessage();
        if (!message.contains("Exception")) {
            return;
        }

        Matcher exceptionMatcher = EXCEPTION_TYPE.matcher(message);
        if (exceptionMatcher.find()) {
            entry.setExceptionType(exceptionMatcher.group(1));
        }

        Matcher sourceMatcher = SOURCE_REFERENCE.matcher(message);
        if (sourceMatcher.find()) {
            entry.setSourceFile(baseName(sourceMatcher.group(1)));
        }
    }

    static String baseName(String path) {
        int separator = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return separator >= 0 ? path.substring(separator + 1) : path;
    }
}
