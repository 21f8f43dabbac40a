package com.care.backoffice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceCreateRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 200, message = "Name must not exceed 200 characters")
    private String name;

    @NotBlank(message = "Description is required")
    @Size(max = 4000, message = "Description must not exceed 4000 characters")
    private String description;

    @Size(max = 200, message = "Short description must not exceed 200 characters")
    private String shortDescription;

    @Min(value = 0, message = "Priority must be between 0 and 1000")
    @Max(value = 1000, message = "Priority must be between 0 and 1000")
    private Integer priority;

    @Min(value = 1, message = "Duration must be between 1 and 480 minutes")
    @Max(value = 480, message = "Duration must be between 1 and 480 minutes")
    private Integer durationMinutes;

    @Min(value = 0, message = "Price must not be negative")
    private Integer priceCents;

    private Boolean active;

    private Long parentId;

    @NotEmpty(message = "At least one image is required")
    private List<@NotBlank(message = "Image URL or path is required") String> images;
}
