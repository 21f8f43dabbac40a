package com.care.backoffice.dto;

import com.care.backoffice.entity.PatientAccount;

import java.time.Instant;

public record PatientAccountView(Long id, Long patientId, String email, String patientName, Instant createdAt) {

    public static PatientAccountView from(PatientAccount a) {
        return new PatientAccountView(a.getId(), a.getPatient().getId(), a.getEmail(),
                a.getPatient().getFullName(), a.getCreatedAt());
    }
}
