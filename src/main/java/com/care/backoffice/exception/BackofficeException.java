package com.care.backoffice.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.List;

/**
 * Base of every error the API turns into a JSON error body. The message is
 * safe to show to the client; anything internal goes to the log only.
 */
public abstract class BackofficeException extends RuntimeException {

    protected BackofficeException(String message) {
        super(message);
    }

    protected BackofficeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract HttpStatus getStatus();

    public List<FieldError> getDetails() {
        return Collections.emptyList();
    }
}
