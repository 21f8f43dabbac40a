package com.care.backoffice.entity;

public enum Role {
    ADMIN,
    STAFF
}
