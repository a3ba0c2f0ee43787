package com.star.logexplorer.exception;

import lombok.Getter;

@Getter
public class DirectoryNotFoundException extends LogFileException {

    private final String directory;

    public DirectoryNotFoundException(String directory) {
        super("Directory does not exist: " + directory);
        this.directory = directory;
    }
}
