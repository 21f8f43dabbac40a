package com.care.backoffice.dto;

import com.care.backoffice.entity.Patient;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record PatientView(
        Long id,
        String firstName,
        String lastName,
        String phone,
        String email,
        LocalDate dob,
        String notes,
        Instant createdAt,
        Instant updatedAt,
        List<ServiceUsageView> serviceUsages
) {

    public static PatientView from(Patient p, List<ServiceUsageView> usages) {
        return new PatientView(p.getId(), p.getFirstName(), p.getLastName(), p.getPhone(), p.getEmail(),
                p.getDob(), p.getNotes(), p.getCreatedAt(), p.getUpdatedAt(), usages);
    }
}
