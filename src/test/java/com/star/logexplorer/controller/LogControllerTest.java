package com.star.logexplorer.controller;

import com.star.logexplorer.dto.LogFileInfo;
import com.star.logexplorer.dto.UploadResponse;
import com.star.logexplorer.dto.query.GroupedLogResults;
import com.star.logexplorer.dto.query.LogSearchCriteria;
import com.star.logexplorer.dto.query.LogStats;
import com.star.logexplorer.entity.LogEntry;
import com.star.logexplorer.entity.LogLevel;
import com.star.logexplorer.exception.DirectoryNotFoundException;
import com.star.logexplorer.exception.FileSizeLimitExceededException;
import com.star.logexplorer.exception.InvalidFileNameException;
import com.star.logexplorer.exception.InvalidUploadException;
import com.star.logexplorer.exception.LogFileException;
import com.star.logexplorer.service.LogFileService;
import com.star.logexplorer.service.LogQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LogController.class)
@AutoConfigureMockMvc(addFilters = false)
class LogControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    private LogQueryService logQueryService;

    @MockitoBean
    private LogFileService logFileService;

    @Nested
    @DisplayName("Search Endpoint Tests")
    class SearchTests {

        @Test
        @DisplayName("Should pass parsed criteria to the query service")
        void shouldSearch() throws Exception {
            Map<String, List<LogEntry>> groups = new LinkedHashMap<>();
            groups.put("2024-01-01.log", List.of(LogEntry.builder()
                    .timestamp(Instant.parse("2024-01-01T08:00:00Z"))
                    .level(LogLevel.ERR)
                    .message("Payment failed")
                    .sourceFile("2024-01-01.log")
                    .build()));
            when(logQueryService.search(any(LogSearchCriteria.class)))
                    .thenReturn(GroupedLogResults.builder().results(groups).totalCount(3).build());

            mockMvc.perform(get("/logs/search")
                            .param("fromDate", "2024-01-01")
                            .param("toDate", "2024-01-01")
                            .param("level", "ERR")
                            .param("pageSize", "1"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.totalCount").value(3))
                    .andExpect(jsonPath("$.data.pageSize").value(1))
                    .andExpect(jsonPath("$.data.groupedByFile").value(true))
                    .andExpect(jsonPath("$.data.results['2024-01-01.log'][0].message").value("Payment failed"))
                    .andExpect(jsonPath("$.data.results['2024-01-01.log'][0].level").value("ERR"));

            ArgumentCaptor<LogSearchCriteria> captor = ArgumentCaptor.forClass(LogSearchCriteria.class);
            verify(logQueryService).search(captor.capture());
            assertEquals(LocalDate.of(2024, 1, 1), captor.getValue().getFromDate());
            assertEquals(LogLevel.ERR, captor.getValue().getLevel());
            assertEquals(1, captor.getValue().getPage());
        }

        @Test
        @DisplayName("Should reject malformed dates")
        void shouldRejectMalformedDate() throws Exception {
            mockMvc.perform(get("/logs/search").param("fromDate", "yesterday"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.error").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.validationErrors[0].field").value("fromDate"));

            verifyNoInteractions(logQueryService);
        }

        @Test
        @DisplayName("Should reject impossible calendar dates")
        void shouldRejectImpossibleDate() throws Exception {
            mockMvc.perform(get("/logs/search").param("toDate", "2024-13-01"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.error").value("INVALID_QUERY"))
                    .andExpect(jsonPath("$.error.validationErrors[0].field").value("toDate"));
        }

        @Test
        @DisplayName("Should reject unknown levels and non-positive pages")
        void shouldRejectBadLevelAndPage() throws Exception {
            mockMvc.perform(get("/logs/search").param("level", "DEBUG"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.validationErrors[0].field").value("level"));

            mockMvc.perform(get("/logs/search").param("page", "0"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.validationErrors[0].field").value("page"));
        }
    }

    @Nested
    @DisplayName("Stats Endpoint Tests")
    class StatsTests {

        @Test
        @DisplayName("Should return statistics for the range")
        void shouldReturnStats() throws Exception {
            when(logQueryService.stats(LocalDate.of(2024, 1, 1), null)).thenReturn(LogStats.builder()
                    .totalEntries(4)
                    .errorCount(3)
                    .warningCount(1)
                    .commonExceptions(new LinkedHashMap<>(Map.of("System.TimeoutException", 2L)))
                    .build());

            mockMvc.perform(get("/logs/stats").param("fromDate", "2024-01-01"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.totalEntries").value(4))
                    .andExpect(jsonPath("$.data.errorCount").value(3))
                    .andExpect(jsonPath("$.data.commonExceptions['System.TimeoutException']").value(2));
        }

        @Test
        @DisplayName("Should reject invalid stats dates")
        void shouldRejectInvalidDate() throws Exception {
            mockMvc.perform(get("/logs/stats").param("toDate", "01-01-2024"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.error").value("INVALID_QUERY"));

            verifyNoInteractions(logQueryService);
        }
    }

    @Nested
    @DisplayName("File Endpoint Tests")
    class FileTests {

        @Test
        @DisplayName("Should list log files")
        void shouldListFiles() throws Exception {
            when(logFileService.listFiles()).thenReturn(List.of(
                    LogFileInfo.builder().name("2024-01-01.log").size(120).build()));

            mockMvc.perform(get("/logs/files"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].name").value("2024-01-01.log"))
                    .andExpect(jsonPath("$.data[0].size").value(120));
        }

        @Test
        @DisplayName("Should upload a log file")
        void shouldUploadFile() throws Exception {
            MockMultipartFile file = new MockMultipartFile("file", "app.log", "text/plain", "line".getBytes());
            when(logFileService.upload(any())).thenReturn(
                    new UploadResponse("2024-01-15T10-30-45-123Z-app.log", "/logs/2024-01-15T10-30-45-123Z-app.log",
                            "app.log", 4));

            mockMvc.perform(multipart("/logs/upload").file(file))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.data.fileName").value("2024-01-15T10-30-45-123Z-app.log"))
                    .andExpect(jsonPath("$.data.originalFileName").value("app.log"));
        }

        @Test
        @DisplayName("Should reject upload without file part")
        void shouldRejectMissingFilePart() throws Exception {
            mockMvc.perform(multipart("/logs/upload"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.error").value("MISSING_PARAMETER"));
        }

        @Test
        @DisplayName("Should map rejected uploads to 400")
        void shouldRejectInvalidUpload() throws Exception {
            MockMultipartFile file = new MockMultipartFile("file", "empty.log", "text/plain", new byte[0]);
            when(logFileService.upload(any())).thenThrow(new InvalidUploadException("No file provided"));

            mockMvc.perform(multipart("/logs/upload").file(file))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.error").value("INVALID_UPLOAD"))
                    .andExpect(jsonPath("$.error.message").value("No file provided"));
        }

        @Test
        @DisplayName("Should map oversized uploads to 413")
        void shouldRejectOversizedUpload() throws Exception {
            MockMultipartFile file = new MockMultipartFile("file", "big.log", "text/plain", "line".getBytes());
            when(logFileService.upload(any())).thenThrow(new FileSizeLimitExceededException(2, 4));

            mockMvc.perform(multipart("/logs/upload").file(file))
                    .andExpect(status().isPayloadTooLarge())
                    .andExpect(jsonPath("$.error.error").value("FILE_SIZE_LIMIT_EXCEEDED"));
        }

        @Test
        @DisplayName("Should delete the requested files")
        void shouldDeleteFiles() throws Exception {
            mockMvc.perform(delete("/logs/files")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"files": ["2024-01-01.log", "2024-01-02.log"]}
                                    """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true));

            verify(logFileService).delete(List.of("2024-01-01.log", "2024-01-02.log"));
        }

        @Test
        @DisplayName("Should reject an empty delete request")
        void shouldRejectEmptyDelete() throws Exception {
            mockMvc.perform(delete("/logs/files")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"files\": []}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.error").value("VALIDATION_ERROR"));

            verifyNoInteractions(logFileService);
        }

        @Test
        @DisplayName("Should reject file names outside the log directory")
        void shouldRejectInvalidFileName() throws Exception {
            doThrow(new InvalidFileNameException("../secret.log")).when(logFileService).delete(any());

            mockMvc.perform(delete("/logs/files")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"files\": [\"../secret.log\"]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.error").value("INVALID_FILE_NAME"));
        }

        @Test
        @DisplayName("Should list files that failed to delete")
        void shouldReportPartialDeleteFailure() throws Exception {
            doThrow(new LogFileException("Some files could not be deleted", List.of("gone.log: NoSuchFileException")))
                    .when(logFileService).delete(any());

            mockMvc.perform(delete("/logs/files")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"files\": [\"gone.log\"]}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.error.error").value("LOG_FILE_ERROR"))
                    .andExpect(jsonPath("$.error.details[0]").value("gone.log: NoSuchFileException"));
        }

        @Test
        @DisplayName("Should inspect a directory")
        void shouldInspectDirectory() throws Exception {
            when(logFileService.inspectDirectory("/var/log/app")).thenReturn(List.of(
                    LogFileInfo.builder().name("nested").path("/var/log/app/nested").directory(true).build()));

            mockMvc.perform(get("/logs/debug").param("path", "/var/log/app"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data[0].directory").value(true));
        }

        @Test
        @DisplayName("Should map a missing inspected directory to 404")
        void shouldReportMissingDirectory() throws Exception {
            when(logFileService.inspectDirectory("/nowhere"))
                    .thenThrow(new DirectoryNotFoundException("/nowhere"));

            mockMvc.perform(get("/logs/debug").param("path", "/nowhere"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.error").value("DIRECTORY_NOT_FOUND"));
        }
    }
}
