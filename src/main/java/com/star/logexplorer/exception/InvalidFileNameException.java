package com.star.logexplorer.exception;

import lombok.Getter;

@Getter
public class InvalidFileNameException extends LogFileException {

    private final String fileName;

    public InvalidFileNameException(String fileName) {
        super(String.format("Invalid log file name: '%s'", fileName));
        this.fileName = fileName;
    }
}
