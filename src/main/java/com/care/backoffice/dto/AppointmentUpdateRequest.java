package com.care.backoffice.dto;

import com.care.backoffice.entity.AppointmentStatus;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * Partial update. A {@code null} field was absent from the body and is left
 * alone; an empty {@link Optional} was sent as JSON {@code null} and clears
 * the stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentUpdateRequest {

    private Optional<Long> patientId;

    private Optional<@Size(max = 200, message = "Patient name must not exceed 200 characters") String> patientName;

    private Long serviceId;

    private Optional<Long> staffId;

    private Instant date;

    private AppointmentStatus status;

    private Optional<@Size(max = 4000, message = "Notes must not exceed 4000 characters") String> notes;
}
