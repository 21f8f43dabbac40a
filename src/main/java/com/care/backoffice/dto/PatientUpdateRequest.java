package com.care.backoffice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Partial patient update. {@code serviceIds}, when present, is the complete
 * desired set of used services.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientUpdateRequest {

    @Size(max = 100, message = "First name must not exceed 100 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "First name is required")
    private String firstName;

    @Size(max = 100, message = "Last name must not exceed 100 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "Last name is required")
    private String lastName;

    private Optional<@Size(min = 5, max = 30, message = "Phone number must be between 5 and 30 characters") String> phone;

    private Optional<@Email(message = "Enter a valid email") String> email;

    private Optional<LocalDate> dob;

    private Optional<@Size(max = 4000, message = "Notes must not exceed 4000 characters") String> notes;

    private List<@NotNull(message = "Service id is required") Long> serviceIds;
}
