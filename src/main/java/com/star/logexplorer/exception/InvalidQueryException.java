package com.star.logexplorer.exception;

import lombok.Getter;

@Getter
public class InvalidQueryException extends RuntimeException {

    private final String field;
    private final Object invalidValue;

    public InvalidQueryException(String message) {
        super(message);
        this.field = null;
        this.invalidValue = null;
    }

    public InvalidQueryException(String field, Object invalidValue, String message) {
        super(message);
        this.field = field;
        this.invalidValue = invalidValue;
    }

    public static InvalidQueryException invalidField(String field, Object value, String reason) {
        return new InvalidQueryException(
                field,
                value,
                String.format("Invalid value '%s' for field '%s': %s", value, field, reason)
        );
    }
}
