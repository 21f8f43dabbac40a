package com.care.backoffice.exception;

import org.springframework.http.HttpStatus;

public class PayloadTooLargeException extends BackofficeException {

    public PayloadTooLargeException(String message) {
        super(message);
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.PAYLOAD_TOO_LARGE;
    }
}
