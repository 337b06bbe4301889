package com.gprintex.rental.domain;

/**
 * A rejected write: machine-readable code plus message.
 */
public record ValidationResult(
    String errorCode,
    String errorMessage
) {
    public static ValidationResult error(String code, String message) {
        return new ValidationResult(code, message);
    }

    public static ValidationResult required(String field) {
        return error("REQUIRED", field + " is required");
    }
}
