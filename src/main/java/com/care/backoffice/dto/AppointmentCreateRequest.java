package com.care.backoffice.dto;

import com.care.backoffice.entity.AppointmentStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Admin booking form. Exactly one of {@code patientId} / {@code patientName}
 * identifies who the visit is for; the service layer enforces that.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentCreateRequest {

    private Long patientId;

    @Size(max = 200, message = "Patient name must not exceed 200 characters")
    private String patientName;

    @NotNull(message = "Service is required")
    private Long serviceId;

    private Long staffId;

    @NotNull(message = "Date is required")
    private Instant date;

    private AppointmentStatus status;

    @Size(max = 4000, message = "Notes must not exceed 4000 characters")
    private String notes;
}
