package com.star.logexplorer.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class LogFileException extends RuntimeException {

    private final List<String> failedFiles;

    public LogFileException(String message) {
        super(message);
        this.failedFiles = List.of();
    }

    public LogFileException(String message, Throwable cause) {
        super(message, cause);
        this.failedFiles = List.of();
    }

    public LogFileException(String message, List<String> failedFiles) {
        super(message);
        this.failedFiles = List.copyOf(failedFiles);
    }
}
