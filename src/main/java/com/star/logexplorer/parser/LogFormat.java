package com.star.logexplorer.parser;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registry of the supported line-oriented log dialects.
 *
 * <p>Each dialect carries two pre-compiled patterns:
 * <ul>
 *   <li>a start-of-entry pattern, used to tell header lines from continuation lines</li>
 *   <li>a parse pattern exposing {@code timestamp}, {@code level} and {@code message} groups</li>
 * </ul>
 *
 * <p>Declaration order is the detection order.
 *
 * @author LogScanner Team
 */
public enum LogFormat {

    /**
     * Example: {@code 2024-01-15 10:30:45.123 +02:00 [ERR] Something failed}
     */
    STANDARD("standard",
            "^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3}.*\\[(?:ERR|WRN|INF)\\]",
            "^(?<timestamp>\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3}(?: [+-]\\d{2}:\\d{2})?)" +
            ".*?\\[(?<level>ERR|WRN|INF)\\](?<message>.*)",
            false),

    /**
     * Example: {@code 2024-01-15 10:30:45 Information Request finished}
     */
    SERILOG("serilog",
            "^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} \\w+ ",
            "^(?<timestamp>\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}) (?<level>\\w+) (?<message>.*)",
            false),

    /**
     * Example: {@code 2024-01-15 10:30:45,123 [Warn] Disk almost full}
     */
    NLOG("nlog",
            "^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d{3} \\[",
            "^(?<timestamp>\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d{3}) \\[(?<level>\\w+)\\] (?<message>.*)",
            true),

    /**
     * Example: {@code 2024-01-15  10:30:45,123  [ERROR]  Connection refused}
     */
    LOG4NET("log4net",
            "^\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2},\\d{3}\\s+\\[\\w+\\]",
            "^(?<timestamp>\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2},\\d{3})\\s+\\[(?<level>\\w+)\\]\\s+(?<message>.*)",
            true);

    private final String formatName;
    private final Pattern startPattern;
    private final Pattern parsePattern;
    private final boolean decimalComma;

    LogFormat(String formatName, String startRegex, String parseRegex, boolean decimalComma) {
        this.formatName = formatName;
        this.startPattern = Pattern.compile(startRegex);
        this.parsePattern = Pattern.compile(parseRegex);
        this.decimalComma = decimalComma;
    }

    public String getFormatName() {
        return formatName;
    }

    public Pattern getStartPattern() {
        return startPattern;
    }

    public Pattern getParsePattern() {
        return parsePattern;
    }

    /**
     * Whether the dialect writes milliseconds after a comma ({@code 10:30:45,123}).
     */
    public boolean usesDecimalComma() {
        return decimalComma;
    }

    public boolean isEntryStart(String line) {
        return line != null && startPattern.matcher(line).find();
    }

    public static Optional<LogFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (LogFormat format : values()) {
            if (format.formatName.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return formatName;
    }
}
