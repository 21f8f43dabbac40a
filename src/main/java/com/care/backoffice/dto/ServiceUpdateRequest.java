package com.care.backoffice.dto;

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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceUpdateRequest {

    @Size(max = 200, message = "Name must not exceed 200 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "Name is required")
    private String name;

    @Size(max = 4000, message = "Description must not exceed 4000 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "Description is required")
    private String description;

    private Optional<@Size(max = 200, message = "Short description must not exceed 200 characters") String> shortDescription;

    private Optional<@Min(value = 0, message = "Priority must be between 0 and 1000")
            @Max(value = 1000, message = "Priority must be between 0 and 1000") Integer> priority;

    private Optional<@Min(value = 1, message = "Duration must be between 1 and 480 minutes")
            @Max(value = 480, message = "Duration must be between 1 and 480 minutes") Integer> durationMinutes;

    private Optional<@Min(value = 0, message = "Price must not be negative") Integer> priceCents;

    private Boolean active;

    private Optional<Long> parentId;

    private List<@NotBlank(message = "Image URL or path is required") String> images;
}
