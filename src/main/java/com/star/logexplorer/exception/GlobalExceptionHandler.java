package com.star.logexplorer.exception;

import com.star.logexplorer.dto.ApiResponse;
import com.star.logexplorer.dto.ErrorResponse;
import com.star.logexplorer.dto.ValidationError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.List;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<?> handleInvalidQuery(
            InvalidQueryException ex,
            HttpServletRequest request) {

        log.warn("Invalid query: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "INVALID_QUERY",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );
        if (ex.getField() != null) {
            errorResponse.setValidationErrors(List.of(new ValidationError(ex.getField(), ex.getMessage())));
        }

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid query parameters", errorResponse));
    }

    @ExceptionHandler(InvalidFileNameException.class)
    public ResponseEntity<?> handleInvalidFileName(
            InvalidFileNameException ex,
            HttpServletRequest request) {

        log.warn("Rejected file name: {}", ex.getFileName());

        ErrorResponse errorResponse = new ErrorResponse(
                "INVALID_FILE_NAME",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid file name", errorResponse));
    }

    @ExceptionHandler(InvalidUploadException.class)
    public ResponseEntity<?> handleInvalidUpload(
            InvalidUploadException ex,
            HttpServletRequest request) {

        log.warn("Rejected upload: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "INVALID_UPLOAD",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid upload", errorResponse));
    }

    @ExceptionHandler(DirectoryNotFoundException.class)
    public ResponseEntity<?> handleDirectoryNotFound(
            DirectoryNotFoundException ex,
            HttpServletRequest request) {

        log.warn("Directory not found: {}", ex.getDirectory());

        ErrorResponse errorResponse = new ErrorResponse(
                "DIRECTORY_NOT_FOUND",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.NOT_FOUND.value()
        );

        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Directory not found", errorResponse));
    }

    @ExceptionHandler(FileSizeLimitExceededException.class)
    public ResponseEntity<?> handleFileSizeLimitExceeded(
            FileSizeLimitExceededException ex,
            HttpServletRequest request) {

        log.error("File size limit exceeded: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "FILE_SIZE_LIMIT_EXCEEDED",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.PAYLOAD_TOO_LARGE.value()
        );

        return ResponseEntity
                .status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error("File size exceeds the allowed limit", errorResponse));
    }

    @ExceptionHandler(LogFileException.class)
    public ResponseEntity<?> handleLogFile(
            LogFileException ex,
            HttpServletRequest request) {

        log.error("Log file operation failed: {}", ex.getMessage(), ex);

        ErrorResponse errorResponse = new ErrorResponse(
                "LOG_FILE_ERROR",
                ex.getMessage(),
                request.getRequestURI(),
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );
        if (!ex.getFailedFiles().isEmpty()) {
            errorResponse.setDetails(ex.getFailedFiles());
        }

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Log file operation failed", errorResponse));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<?> handleMaxUploadSizeExceeded(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request) {

        log.error("Max upload size exceeded: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "MAX_UPLOAD_SIZE_EXCEEDED",
                "File size exceeds the maximum allowed size for upload",
                request.getRequestURI(),
                HttpStatus.PAYLOAD_TOO_LARGE.value()
        );

        return ResponseEntity
                .status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error("File too large", errorResponse));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ValidationError> validationErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new ValidationError(error.getField(), error.getDefaultMessage()))
                .collect(Collectors.toList());

        log.warn("Validation failed for {}: {}", request.getRequestURI(), validationErrors);

        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "Validation failed for one or more fields",
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value(),
                validationErrors
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Validation failed", errorResponse));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<?> handleMissingParameter(
            MissingServletRequestParameterException ex,
            HttpServletRequest request) {

        log.error("Missing request parameter: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "MISSING_PARAMETER",
                String.format("Required parameter '%s' is missing", ex.getParameterName()),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Missing required parameter", errorResponse));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<?> handleMissingPart(
            MissingServletRequestPartException ex,
            HttpServletRequest request) {

        log.error("Missing request part: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "MISSING_PARAMETER",
                String.format("Required part '%s' is missing", ex.getRequestPartName()),
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Missing required parameter", errorResponse));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        log.warn("Unreadable request body: {}", ex.getMessage());

        ErrorResponse errorResponse = new ErrorResponse(
                "MALFORMED_REQUEST",
                "Request body is missing or malformed",
                request.getRequestURI(),
                HttpStatus.BAD_REQUEST.value()
        );

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Malformed request", errorResponse));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);

        ErrorResponse errorResponse = new ErrorResponse(
                "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI(),
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Internal server error", errorResponse));
    }
}
