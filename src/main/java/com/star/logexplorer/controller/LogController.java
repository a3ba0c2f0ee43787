package com.star.logexplorer.controller;

import com.star.logexplorer.dto.ApiResponse;
import com.star.logexplorer.dto.DeleteFilesRequest;
import com.star.logexplorer.dto.LogFileInfo;
import com.star.logexplorer.dto.UploadResponse;
import com.star.logexplorer.dto.query.GroupedLogResults;
import com.star.logexplorer.dto.query.LogSearchCriteria;
import com.star.logexplorer.dto.query.LogSearchRequest;
import com.star.logexplorer.dto.query.LogSearchResponse;
import com.star.logexplorer.dto.query.LogStats;
import com.star.logexplorer.service.LogFileService;
import com.star.logexplorer.service.LogQueryService;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/logs")
@Slf4j
public class LogController {

    @Autowired
    private LogQueryService logQueryService;

    @Autowired
    private LogFileService logFileService;

    @GetMapping("/search")
    public ResponseEntity<ApiResponse<LogSearchResponse>> searchLogs(
            @Valid @ModelAttribute LogSearchRequest request) {

        log.debug("Search request: {}", request);

        LogSearchCriteria criteria = request.toCriteria();
        GroupedLogResults results = logQueryService.search(criteria);

        return ResponseEntity.ok(
                ApiResponse.success("Search completed successfully", LogSearchResponse.of(results, criteria))
        );
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<LogStats>> getStats(
            @Parameter(description = "First day to include (YYYY-MM-DD)")
            @RequestParam(required = false) String fromDate,
            @Parameter(description = "Last day to include (YYYY-MM-DD)")
            @RequestParam(required = false) String toDate) {

        LocalDate from = LogSearchRequest.parseDate("fromDate", fromDate);
        LocalDate to = LogSearchRequest.parseDate("toDate", toDate);

        return ResponseEntity.ok(
                ApiResponse.success("Statistics retrieved successfully", logQueryService.stats(from, to))
        );
    }

    @GetMapping("/files")
    public ResponseEntity<ApiResponse<List<LogFileInfo>>> listFiles() {
        return ResponseEntity.ok(
                ApiResponse.success("Log files retrieved successfully", logFileService.listFiles())
        );
    }

    @DeleteMapping("/files")
    public ResponseEntity<ApiResponse<Void>> deleteFiles(
            @Valid @RequestBody DeleteFilesRequest request) {

        log.info("Received delete request for {} files", request.getFiles().size());

        logFileService.delete(request.getFiles());

        return ResponseEntity.ok(ApiResponse.success("Files deleted successfully", null));
    }

    @PostMapping("/upload")
    public ResponseEntity<ApiResponse<UploadResponse>> uploadLogFile(
            @RequestParam("file") MultipartFile file) {

        log.info("Received file upload request: {} ({})",
                file.getOriginalFilename(),
                file.getSize());

        UploadResponse response = logFileService.upload(file);

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success("File uploaded successfully", response));
    }

    @GetMapping("/debug")
    public ResponseEntity<ApiResponse<List<LogFileInfo>>> inspectDirectory(
            @Parameter(description = "Directory to inspect, defaults to the log directory")
            @RequestParam(required = false) String path) {

        return ResponseEntity.ok(
                ApiResponse.success("Directory inspected successfully", logFileService.inspectDirectory(path))
        );
    }
}
