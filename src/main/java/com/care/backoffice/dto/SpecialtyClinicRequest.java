package com.care.backoffice.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpecialtyClinicRequest {

    @Size(max = 200)
    @Pattern(regexp = "(?s).*\\S.*", message = "Title is required")
    private String title;

    @Size(max = 200)
    @Pattern(regexp = "(?s).*\\S.*", message = "Name is required")
    private String name;

    @Size(max = 4000)
    @Pattern(regexp = "(?s).*\\S.*", message = "Description is required")
    private String description;

    @Size(max = 1000)
    @Pattern(regexp = "(?s).*\\S.*", message = "Image is required")
    private String image;
}
