package com.star.logexplorer.dto.query;

import com.star.logexplorer.entity.LogEntry;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Log search response")
public class LogSearchResponse {

    @Schema(description = "Paged entries per source file")
    private Map<String, List<LogEntry>> results;

    @Schema(description = "Matching entries before paging")
    private long totalCount;

    @Schema(description = "Page number (1-based)", example = "1")
    private int page;

    @Schema(description = "Entries per file group", example = "20")
    private int pageSize;

    @Schema(description = "Always true: paging applies to each file group")
    private boolean groupedByFile;

    public static LogSearchResponse of(GroupedLogResults grouped, LogSearchCriteria criteria) {
        return LogSearchResponse.builder()
                .results(grouped.getResults())
                .totalCount(grouped.getTotalCount())
                .page(criteria.getEffectivePage())
                .pageSize(criteria.getEffectivePageSize())
                .groupedByFile(true)
                .build();
    }
}
