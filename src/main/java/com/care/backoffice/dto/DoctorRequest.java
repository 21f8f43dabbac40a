package com.care.backoffice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Used for both create and partial update of a doctor profile. On update an
 * absent field is left alone and an explicit {@code null} clears it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DoctorRequest {

    @Size(max = 150, message = "Full name must not exceed 150 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "Full name is required")
    private String fullName;

    private Optional<@Size(max = 100) String> title;

    private Optional<@Size(max = 150) String> specialty;

    private Optional<@Size(max = 240, message = "Short bio must not exceed 240 characters") String> shortBio;

    private Optional<@Size(max = 8000) String> bio;

    private Optional<@Email(message = "Invalid email") String> email;

    private Optional<@Pattern(regexp = "^$|^.{5,30}$", message = "Phone number must be between 5 and 30 characters") String> phone;

    private Optional<@Min(value = 0, message = "Years of experience must be between 0 and 80")
            @Max(value = 80, message = "Years of experience must be between 0 and 80") Integer> yearsExperience;

    private Optional<@Min(value = 0, message = "Priority must be between 0 and 1000")
            @Max(value = 1000, message = "Priority must be between 0 and 1000") Integer> priority;

    private List<@NotBlank String> languages;

    private Optional<@Size(max = 1000) String> photoUrl;

    private List<@NotBlank String> gallery;

    private Boolean active;

    private Boolean featured;
}
