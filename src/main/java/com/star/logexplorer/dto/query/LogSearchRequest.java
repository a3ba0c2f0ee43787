package com.star.logexplorer.dto.query;

import com.star.logexplorer.entity.LogLevel;
import com.star.logexplorer.exception.InvalidQueryException;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Search parameters as they arrive over HTTP.
 *
 * <p>Example: {@code GET /logs/search?fromDate=2024-01-15&toDate=2024-01-15&level=ERR&page=1&pageSize=20}
 *
 * @author Eshmamatov Obidjon
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Log search request")
public class LogSearchRequest {

    static final String DATE_REGEX = "^\\d{4}-\\d{2}-\\d{2}$";

    @Pattern(regexp = DATE_REGEX, message = "fromDate must be formatted as YYYY-MM-DD")
    @Schema(description = "First day to include", example = "2024-01-15")
    private String fromDate;

    @Pattern(regexp = DATE_REGEX, message = "toDate must be formatted as YYYY-MM-DD")
    @Schema(description = "Last day to include", example = "2024-01-15")
    private String toDate;

    @Pattern(regexp = "^(?i)(ERR|WRN|INF)?$", message = "level must be one of ERR, WRN, INF")
    @Schema(description = "Log level", example = "ERR", allowableValues = {"ERR", "WRN", "INF"})
    private String level;

    @Schema(description = "Case-insensitive text contained in the message", example = "timeout")
    private String searchText;

    @Schema(description = "Case-insensitive part of the exception type", example = "NullReference")
    private String exceptionType;

    @Schema(description = "Case-insensitive part of the source file name", example = "2024-01-15.log")
    private String sourceFile;

    @Min(value = 1, message = "Page number must be >= 1")
    @Schema(description = "Page number (1-based)", example = "1", defaultValue = "1")
    @Builder.Default
    private Integer page = LogSearchCriteria.DEFAULT_PAGE;

    @Min(value = 1, message = "Page size must be >= 1")
    @Schema(description = "Entries per file group", example = "20", defaultValue = "20")
    @Builder.Default
    private Integer pageSize = LogSearchCriteria.DEFAULT_PAGE_SIZE;

    public LogSearchCriteria toCriteria() {
        return LogSearchCriteria.builder()
                .fromDate(parseDate("fromDate", fromDate))
                .toDate(parseDate("toDate", toDate))
                .level(parseLevel(level))
                .searchText(blankToNull(searchText))
                .exceptionType(blankToNull(exceptionType))
                .sourceFile(blankToNull(sourceFile))
                .page(page != null ? page : LogSearchCriteria.DEFAULT_PAGE)
                .pageSize(pageSize != null ? pageSize : LogSearchCriteria.DEFAULT_PAGE_SIZE)
                .build();
    }

    public static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw InvalidQueryException.invalidField(field, value, "expected a calendar date as YYYY-MM-DD");
        }
    }

    private static LogLevel parseLevel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        LogLevel level = LogLevel.fromToken(value);
        if (level == null) {
            throw InvalidQueryException.invalidField("level", value, "expected one of ERR, WRN, INF");
        }
        return level;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
