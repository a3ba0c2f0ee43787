package com.star.logexplorer.dto.query;

import com.star.logexplorer.entity.LogLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Query parameters understood by the search pipeline.
 *
 * <p>Dates are inclusive whole days. Text filters are case-insensitive
 * substring matches; {@code null} or blank means no filter. An inverted
 * date range is accepted and simply matches nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogSearchCriteria {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;

    private LocalDate fromDate;

    private LocalDate toDate;

    private LogLevel level;

    private String searchText;

    private String exceptionType;

    private String sourceFile;

    @Builder.Default
    private int page = DEFAULT_PAGE;

    @Builder.Default
    private int pageSize = DEFAULT_PAGE_SIZE;

    public static LogSearchCriteria forDateRange(LocalDate fromDate, LocalDate toDate) {
        return LogSearchCriteria.builder()
                .fromDate(fromDate)
                .toDate(toDate)
                .build();
    }

    public boolean hasDateRange() {
        return fromDate != null || toDate != null;
    }

    public int getEffectivePage() {
        return page > 0 ? page : DEFAULT_PAGE;
    }

    public int getEffectivePageSize() {
        return pageSize > 0 ? pageSize : DEFAULT_PAGE_SIZE;
    }
}
