package com.care.backoffice.exception;

public record FieldError(String field, String message) {
}
