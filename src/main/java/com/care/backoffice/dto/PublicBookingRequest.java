package com.care.backoffice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Booking submitted from the public website. No staff, no status. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicBookingRequest {

    private Long patientId;

    @Size(max = 200, message = "Patient name must not exceed 200 characters")
    private String patientName;

    @NotNull(message = "Service is required")
    private Long serviceId;

    @NotNull(message = "Date is required")
    private Instant date;

    @Size(max = 4000, message = "Notes must not exceed 4000 characters")
    private String notes;
}
