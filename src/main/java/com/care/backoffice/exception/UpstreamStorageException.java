package com.care.backoffice.exception;

import org.springframework.http.HttpStatus;

/** The file storage backend could not be reached or refused the write. */
public class UpstreamStorageException extends BackofficeException {

    public UpstreamStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
