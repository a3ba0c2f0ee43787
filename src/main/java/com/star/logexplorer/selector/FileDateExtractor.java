package com.star.logexplorer.selector;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a calendar date embedded in a file name. Patterns are tried in
 * order: {@code yyyyMMdd}, {@code yyyy-MM-dd}, {@code yyyy_MM_dd}. Digit
 * groups that do not form a real date are skipped.
 */
public final class FileDateExtractor {

    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("(\\d{4})(\\d{2})(\\d{2})"),
            Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})"),
            Pattern.compile("(\\d{4})_(\\d{2})_(\\d{2})")
    );

    private FileDateExtractor() {
    }

    public static Optional<LocalDate> extractDate(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return Optional.empty();
        }

        String baseName = stripExtension(fileName);
        for (Pattern pattern : DATE_PATTERNS) {
            Matcher matcher = pattern.matcher(baseName);
            if (matcher.find()) {
                try {
                    return Optional.of(LocalDate.of(
                            Integer.parseInt(matcher.group(1)),
                            Integer.parseInt(matcher.group(2)),
                            Integer.parseInt(matcher.group(3))));
                } catch (DateTimeException e) {
                    // not a calendar date, try the next pattern
                }
            }
        }
        return Optional.empty();
    }

    static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
