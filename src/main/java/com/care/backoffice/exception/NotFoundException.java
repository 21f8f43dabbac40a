package com.care.backoffice.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends BackofficeException {

    private final String entity;
    private final Object id;

    public NotFoundException(String entity, Object id) {
        super("Not found");
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public Object getId() {
        return id;
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
