package com.care.backoffice.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * A reference to another record that does not exist, or a delete blocked by
 * records that still point at the target.
 */
public class IntegrityException extends BackofficeException {

    private final String field;

    public IntegrityException(String field, String message) {
        super(message);
        this.field = field;
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
        this.field = null;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }

    @Override
    public List<FieldError> getDetails() {
        return field == null ? List.of() : List.of(new FieldError(field, getMessage()));
    }
}
