package com.star.logexplorer.query;

import com.star.logexplorer.config.LogExplorerProperties;
import com.star.logexplorer.dto.query.LogSearchCriteria;
import com.star.logexplorer.entity.LogEntry;
import com.star.logexplorer.entity.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Builds in-memory predicates from search criteria. All filters are
 * combined with AND logic.
 *
 * <p>Date bounds cover whole days in the configured zone: {@code fromDate}
 * starts at 00:00:00.000 and {@code toDate} ends at 23:59:59.999.
 */
@Component
@Slf4j
public class LogEntryFilter {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    private final ZoneId zone;

    @Autowired
    public LogEntryFilter(LogExplorerProperties properties) {
        this(properties.getZoneId());
    }

    public LogEntryFilter(ZoneId zone) {
        this.zone = zone;
    }

    public Predicate<LogEntry> buildSearchPredicate(LogSearchCriteria criteria) {
        List<Predicate<LogEntry>> filters = new ArrayList<>();

        addDateRange(filters, criteria.getFromDate(), criteria.getToDate());

        if (criteria.getLevel() != null) {
            filters.add(levelEquals(criteria.getLevel()));
        }
        if (hasText(criteria.getSearchText())) {
            filters.add(containsIgnoreCase(LogEntry::getMessage, criteria.getSearchText()));
        }
        if (hasText(criteria.getExceptionType())) {
            filters.add(containsIgnoreCase(LogEntry::getExceptionType, criteria.getExceptionType()));
        }
        if (hasText(criteria.getSourceFile())) {
            filters.add(containsIgnoreCase(LogEntry::getSourceFile, criteria.getSourceFile()));
        }

        log.debug("Built search predicate with {} filters", filters.size());
        return combine(filters);
    }

    public Predicate<LogEntry> buildDateRangePredicate(LocalDate fromDate, LocalDate toDate) {
        List<Predicate<LogEntry>> filters = new ArrayList<>();
        addDateRange(filters, fromDate, toDate);
        return combine(filters);
    }

    public Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(zone).toInstant();
    }

    public Instant endOfDay(LocalDate date) {
        return date.atTime(END_OF_DAY).atZone(zone).toInstant();
    }

    private void addDateRange(List<Predicate<LogEntry>> filters, LocalDate fromDate, LocalDate toDate) {
        if (fromDate != null) {
            Instant from = startOfDay(fromDate);
            filters.add(entry -> !entry.getTimestamp().isBefore(from));
        }
        if (toDate != null) {
            Instant to = endOfDay(toDate);
            filters.add(entry -> !entry.getTimestamp().isAfter(to));
        }
    }

    private static Predicate<LogEntry> levelEquals(LogLevel level) {
        return entry -> entry.getLevel() == level;
    }

    private static Predicate<LogEntry> containsIgnoreCase(Function<LogEntry, String> field, String needle) {
        String lowerNeedle = needle.toLowerCase(Locale.ROOT);
        return entry -> {
            String value = field.apply(entry);
            return value != null && value.toLowerCase(Locale.ROOT).contains(lowerNeedle);
        };
    }

    private static Predicate<LogEntry> combine(List<Predicate<LogEntry>> filters) {
        return filters.stream().reduce(entry -> true, Predicate::and);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
