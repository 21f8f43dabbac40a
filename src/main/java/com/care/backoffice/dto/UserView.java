package com.care.backoffice.dto;

import com.care.backoffice.entity.Role;
import com.care.backoffice.entity.StaffUser;

import java.time.Instant;

public record UserView(Long id, String email, String name, Role role, Instant createdAt, Instant updatedAt) {

    public static UserView from(StaffUser u) {
        return new UserView(u.getId(), u.getEmail(), u.getName(), u.getRole(), u.getCreatedAt(), u.getUpdatedAt());
    }
}
