package com.star.logexplorer.exception;

import lombok.Getter;

@Getter
public class FileSizeLimitExceededException extends LogFileException {
    private final long maxSize;
    private final long actualSize;

    public FileSizeLimitExceededException(long maxSize, long actualSize) {
        super(String.format("File size exceeds limit. Maximum: %d bytes, Actual: %d bytes",
                maxSize, actualSize));
        this.maxSize = maxSize;
        this.actualSize = actualSize;
    }

}
