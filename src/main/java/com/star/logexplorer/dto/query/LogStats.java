package com.star.logexplorer.dto.query;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregates over the entries of a date range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Log statistics")
public class LogStats {

    public static final int TOP_LIMIT = 5;

    @Schema(description = "Entries in range", example = "1234")
    private long totalEntries;

    @Schema(description = "ERR entries")
    private long errorCount;

    @Schema(description = "WRN entries")
    private long warningCount;

    @Schema(description = "INF entries")
    private long infoCount;

    @Schema(description = "Most frequent exception types with counts, most frequent first")
    @Builder.Default
    private Map<String, Long> commonExceptions = new LinkedHashMap<>();

    @Schema(description = "Most frequent source files with counts, most frequent first")
    @Builder.Default
    private Map<String, Long> commonSources = new LinkedHashMap<>();

    public static LogStats empty() {
        return LogStats.builder().build();
    }
}
