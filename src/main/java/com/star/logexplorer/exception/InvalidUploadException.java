package com.star.logexplorer.exception;

/**
 * Upload rejected because of what the client sent, e.g. an empty file.
 */
public class InvalidUploadException extends LogFileException {

    public InvalidUploadException(String message) {
        super(message);
    }
}
