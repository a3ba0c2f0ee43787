package com.star.logexplorer.selector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FileDateExtractorTest {

    @ParameterizedTest
    @CsvSource({
            "20240115.log, 2024-01-15",
            "app-20240115.txt, 2024-01-15",
            "2024-01-15.log, 2024-01-15",
            "api-2024-01-15.log, 2024-01-15",
            "api_2024_01_15.log, 2024-01-15",
            "2024-01-15, 2024-01-15"
    })
    @DisplayName("Should extract embedded dates")
    void shouldExtractDate(String fileName, LocalDate expected) {
        assertEquals(expected, FileDateExtractor.extractDate(fileName).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"service.log", "app-2024.log", "build-1234.txt", ""})
    @DisplayName("Should return empty when no date is embedded")
    void shouldReturnEmptyWithoutDate(String fileName) {
        assertTrue(FileDateExtractor.extractDate(fileName).isEmpty());
    }

    @Test
    @DisplayName("Should skip digit groups that are not calendar dates")
    void shouldSkipInvalidDigitGroups() {
        assertEquals(LocalDate.of(2024, 2, 3),
                FileDateExtractor.extractDate("app-20241399-2024-02-03.log").orElseThrow());
        assertTrue(FileDateExtractor.extractDate("2024-02-30.log").isEmpty());
    }

    @Test
    @DisplayName("Should strip only the last extension")
    void shouldStripExtension() {
        assertEquals("app.2024", FileDateExtractor.stripExtension("app.2024.log"));
        assertEquals(".hidden", FileDateExtractor.stripExtension(".hidden"));
        assertEquals("plain", FileDateExtractor.stripExtension("plain"));
    }
}
