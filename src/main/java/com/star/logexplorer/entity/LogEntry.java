package com.star.logexplorer.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogEntry {

    private Instant timestamp;  // Always UTC

    private LogLevel level;

    private String message;  // Header message plus continuation lines

    private String exceptionType;  // e.g. System.NullReferenceException

    private String sourceFile;  // Basename of the log file once loaded, or of the referenced source file

    private String stackTrace;  // First run of "at ..." frames
}
