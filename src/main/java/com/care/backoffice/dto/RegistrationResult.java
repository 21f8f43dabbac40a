package com.care.backoffice.dto;

import java.time.Instant;

public record RegistrationResult(PatientSummary patient, AccountSummary account) {

    public record PatientSummary(Long id, String firstName, String lastName, String email, String phone) {
    }

    public record AccountSummary(Long id, Instant createdAt) {
    }
}
