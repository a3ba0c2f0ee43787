package com.star.logexplorer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String error;
    private String message;
    private String path;
    private int status;
    private Instant timestamp;
    private List<ValidationError> validationErrors;
    private List<String> details;

    public ErrorResponse(String error, String message, String path, int status) {
        this.error = error;
        this.message = message;
        this.path = path;
        this.status = status;
        this.timestamp = Instant.now();
    }

    public ErrorResponse(String error, String message, String path, int status,
                         List<ValidationError> validationErrors) {
        this(error, message, path, status);
        this.validationErrors = validationErrors;
    }
}
