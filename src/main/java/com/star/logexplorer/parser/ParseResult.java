package com.star.logexplorer.parser;

import com.star.logexplorer.entity.LogEntry;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of parsing a header line. An entry is always present; a
 * {@link Status#DEFAULTED} result records which fields fell back to
 * defaults and why.
 *
 * @author Eshmamatov Obidjon
 */
@Getter
@Builder
public class ParseResult {

    public enum Status {
        PARSED,
        DEFAULTED
    }

    private final Status status;
    private final LogEntry entry;
    private final LogFormat format;
    private final String rawLine;
    private final String reason;

    public static ParseResult parsed(LogEntry entry, LogFormat format, String rawLine) {
        return ParseResult.builder()
                .status(Status.PARSED)
                .entry(entry)
                .format(format)
                .rawLine(rawLine)
                .build();
    }

    public static ParseResult defaulted(LogEntry entry, LogFormat format, String rawLine, String reason) {
        return ParseResult.builder()
                .status(Status.DEFAULTED)
                .entry(entry)
                .format(format)
                .rawLine(rawLine)
                .reason(reason)
                .build();
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public boolean isDefaulted() {
        return status == Status.DEFAULTED;
    }

    @Override
    public String toString() {
        return String.format("ParseResult{status=%s, format=%s, reason='%s'}",
                status, format, reason != null ? reason : "none");
    }
}
