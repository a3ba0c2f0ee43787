package com.star.logexplorer.dto.query;

import com.star.logexplorer.entity.LogEntry;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search results keyed by source file name. Each group holds one page of
 * that file's entries; {@code totalCount} counts every matching entry
 * before paging.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Search results grouped by source file")
public class GroupedLogResults {

    public static final String UNKNOWN_GROUP = "unknown";

    @Schema(description = "Paged entries per source file, newest first")
    @Builder.Default
    private Map<String, List<LogEntry>> results = new LinkedHashMap<>();

    @Schema(description = "Matching entries across all files before paging", example = "1234")
    private long totalCount;

    public static GroupedLogResults empty() {
        return GroupedLogResults.builder().totalCount(0).build();
    }

    public int getReturnedCount() {
        return results.values().stream().mapToInt(List::size).sum();
    }
}
