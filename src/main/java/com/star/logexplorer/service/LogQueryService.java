package com.star.logexplorer.service;

import com.star.logexplorer.config.LogExplorerProperties;
import com.star.logexplorer.dto.query.GroupedLogResults;
import com.star.logexplorer.dto.query.LogSearchCriteria;
import com.star.logexplorer.dto.query.LogStats;
import com.star.logexplorer.entity.LogEntry;
import com.star.logexplorer.entity.LogLevel;
import com.star.logexplorer.parser.LogFileParser;
import com.star.logexplorer.query.LogEntryFilter;
import com.star.logexplorer.selector.LogFileSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for searching and summarising the log files of a directory.
 *
 * <p>Every call selects the relevant files, parses them from scratch and
 * works on the entries in memory; nothing is cached between calls. Failures
 * while reading the directory degrade to empty results.
 *
 * @author LogScanner Team
 * @version 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogQueryService {

    private final LogFileSelector fileSelector;
    private final LogFileParser fileParser;
    private final LogEntryFilter entryFilter;
    private final LogExplorerProperties properties;

    public GroupedLogResults search(LogSearchCriteria criteria) {
        return search(properties.getDirectoryPath(), criteria);
    }

    public GroupedLogResults search(Path directory, LogSearchCriteria criteria) {
        long startTime = System.currentTimeMillis();

        log.info("Searching logs in {}, page: {}, pageSize: {}",
                directory, criteria.getEffectivePage(), criteria.getEffectivePageSize());

        try {
            List<LogEntry> filtered = loadEntries(directory, criteria.getFromDate(), criteria.getToDate())
                    .stream()
                    .filter(entryFilter.buildSearchPredicate(criteria))
                    .sorted(Comparator.comparing(LogEntry::getTimestamp).reversed())
                    .collect(Collectors.toList());

            Map<String, List<LogEntry>> groups = new LinkedHashMap<>();
            for (LogEntry entry : filtered) {
                String key = entry.getSourceFile() != null ? entry.getSourceFile() : GroupedLogResults.UNKNOWN_GROUP;
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
            }

            int pageSize = criteria.getEffectivePageSize();
            long start = (long) (criteria.getEffectivePage() - 1) * pageSize;

            Map<String, List<LogEntry>> paged = new LinkedHashMap<>();
            groups.forEach((fileName, entries) -> paged.put(fileName, slice(entries, start, pageSize)));

            GroupedLogResults results = GroupedLogResults.builder()
                    .results(paged)
                    .totalCount(filtered.size())
                    .build();

            log.info("Search completed: {} matches in {} files, {} returned in {} ms",
                    filtered.size(), paged.size(), results.getReturnedCount(),
                    System.currentTimeMillis() - startTime);

            return results;

        } catch (RuntimeException e) {
            log.error("Error searching logs in {}", directory, e);
            return GroupedLogResults.empty();
        }
    }

    public LogStats stats(LocalDate fromDate, LocalDate toDate) {
        return stats(properties.getDirectoryPath(), fromDate, toDate);
    }

    public LogStats stats(Path directory, LocalDate fromDate, LocalDate toDate) {
        log.info("Computing log stats for {}, range: {}..{}", directory, fromDate, toDate);

        try {
            List<LogEntry> filtered = loadEntries(directory, fromDate, toDate)
                    .stream()
                    .filter(entryFilter.buildDateRangePredicate(fromDate, toDate))
                    .collect(Collectors.toList());

            Map<LogLevel, Long> levelCounts = filtered.stream()
                    .collect(Collectors.groupingBy(LogEntry::getLevel, Collectors.counting()));

            LogStats stats = LogStats.builder()
                    .totalEntries(filtered.size())
                    .errorCount(levelCounts.getOrDefault(LogLevel.ERR, 0L))
                    .warningCount(levelCounts.getOrDefault(LogLevel.WRN, 0L))
                    .infoCount(levelCounts.getOrDefault(LogLevel.INF, 0L))
                    .commonExceptions(topCounts(filtered, LogEntry::getExceptionType, LogStats.TOP_LIMIT))
                    .commonSources(topCounts(filtered, LogEntry::getSourceFile, LogStats.TOP_LIMIT))
                    .build();

            log.debug("Stats: {}", stats);
            return stats;

        } catch (RuntimeException e) {
            log.error("Error getting log stats for {}", directory, e);
            return LogStats.empty();
        }
    }

    /**
     * Frequency table of the non-null values of a field, most frequent first.
     * Equal counts keep the order in which the values were first seen.
     */
    static Map<String, Long> topCounts(List<LogEntry> entries, Function<LogEntry, String> field, int limit) {
        Map<String, Long> counts = entries.stream()
                .map(field)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }

    private List<LogEntry> loadEntries(Path directory, LocalDate fromDate, LocalDate toDate) {
        List<Path> files = fileSelector.selectFiles(directory, fromDate, toDate);
        List<LogEntry> allEntries = new ArrayList<>();

        for (Path file : files) {
            List<LogEntry> entries = fileParser.parseFile(file);
            String fileName = file.getFileName().toString();
            entries.forEach(entry -> entry.setSourceFile(fileName));
            allEntries.addAll(entries);
        }

        log.debug("Loaded {} entries from {} files in {}", allEntries.size(), files.size(), directory);
        return allEntries;
    }

    private static List<LogEntry> slice(List<LogEntry> entries, long start, int pageSize) {
        if (start >= entries.size()) {
            return List.of();
        }
        int from = (int) start;
        int to = (int) Math.min(entries.size(), start + pageSize);
        return new ArrayList<>(entries.subList(from, to));
    }
}
