package com.star.logexplorer.selector;

import com.star.logexplorer.config.LogExplorerProperties;
import com.star.logexplorer.dto.query.LogSearchCriteria;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Narrows a log directory down to the files worth parsing for a date range.
 *
 * <p>A file's date comes from its name when it embeds one, otherwise from
 * its last-modified time in the configured zone. When the range would
 * exclude every file the range is ignored and all files are returned.
 */
@Component
@Slf4j
public class LogFileSelector {

    private final ZoneId zone;

    @Autowired
    public LogFileSelector(LogExplorerProperties properties) {
        this(properties.getZoneId());
    }

    public LogFileSelector(ZoneId zone) {
        this.zone = zone;
    }

    public List<Path> selectFiles(Path directory, LogSearchCriteria criteria) {
        if (criteria == null || !criteria.hasDateRange()) {
            return selectFiles(directory, null, null);
        }
        return selectFiles(directory, criteria.getFromDate(), criteria.getToDate());
    }

    public List<Path> selectFiles(Path directory, LocalDate fromDate, LocalDate toDate) {
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Log directory does not exist: {}", directory);
            return List.of();
        }

        List<Path> allFiles;
        try {
            allFiles = listRegularFiles(directory);
        } catch (IOException | RuntimeException e) {
            log.warn("Error listing log directory: {}", directory, e);
            return List.of();
        }

        if (fromDate == null && toDate == null) {
            return allFiles;
        }

        List<Path> relevant = allFiles.stream()
                .filter(file -> isWithinRange(resolveFileDate(file), fromDate, toDate))
                .collect(Collectors.toList());

        if (relevant.isEmpty() && !allFiles.isEmpty()) {
            log.debug("Date range {}..{} excluded all {} files in {}, using all files",
                    fromDate, toDate, allFiles.size(), directory);
            return allFiles;
        }

        log.debug("Selected {} of {} files in {} for range {}..{}",
                relevant.size(), allFiles.size(), directory, fromDate, toDate);
        return relevant;
    }

    /**
     * Date used for range checks, or empty when neither the name nor the
     * file attributes can provide one.
     */
    public Optional<LocalDate> resolveFileDate(Path file) {
        Optional<LocalDate> fromName = FileDateExtractor.extractDate(file.getFileName().toString());
        if (fromName.isPresent()) {
            return fromName;
        }

        try {
            return Optional.of(LocalDate.ofInstant(Files.getLastModifiedTime(file).toInstant(), zone));
        } catch (IOException e) {
            log.debug("Could not read modification time of {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Path> listRegularFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private static boolean isWithinRange(Optional<LocalDate> fileDate, LocalDate fromDate, LocalDate toDate) {
        // files without a resolvable date stay in
        if (fileDate.isEmpty()) {
            return true;
        }
        LocalDate date = fileDate.get();
        if (fromDate != null && date.isBefore(fromDate)) {
            return false;
        }
        return toDate == null || !date.isAfter(toDate);
    }
}
