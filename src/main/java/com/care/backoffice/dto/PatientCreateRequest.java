package com.care.backoffice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientCreateRequest {

    @NotBlank(message = "First name is required")
    @Size(max = 100, message = "First name must not exceed 100 characters")
    private String firstName;

    @NotBlank(message = "Last name is required")
    @Size(max = 100, message = "Last name must not exceed 100 characters")
    private String lastName;

    @Size(min = 5, max = 30, message = "Phone number must be between 5 and 30 characters")
    private String phone;

    @Email(message = "Enter a valid email")
    private String email;

    private LocalDate dob;

    @Size(max = 4000, message = "Notes must not exceed 4000 characters")
    private String notes;

    private List<@NotNull(message = "Service id is required") Long> serviceIds;
}
