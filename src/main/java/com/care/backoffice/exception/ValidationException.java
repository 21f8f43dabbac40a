package com.care.backoffice.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ValidationException extends BackofficeException {

    private final List<FieldError> details;

    public ValidationException(List<FieldError> details) {
        super("Validation failed.");
        this.details = List.copyOf(details);
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(List.of(new FieldError(field, message)));
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public List<FieldError> getDetails() {
        return details;
    }
}
