package com.star.logexplorer.dto;

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
public class LogFileInfo {
    private String name;
    private String path;  // Only filled for directory inspection
    private long size;
    private Instant created;
    private Instant lastModified;
    private Boolean directory;
}
