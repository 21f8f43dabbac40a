package com.care.backoffice.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

public class ConflictException extends BackofficeException {

    private final String field;

    public ConflictException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }

    @Override
    public List<FieldError> getDetails() {
        return field == null ? List.of() : List.of(new FieldError(field, getMessage()));
    }
}
