package com.care.backoffice.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Blog post create / partial update. When {@code slug} is omitted on create it
 * is derived from the title.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlogRequest {

    @Size(max = 200, message = "Title must not exceed 200 characters")
    @Pattern(regexp = "(?s).*\\S.*", message = "Title is required")
    private String title;

    @Size(max = 200, message = "Slug must not exceed 200 characters")
    private String slug;

    private Optional<@Size(max = 1000) String> excerpt;

    private Optional<String> content;

    private Boolean published;

    private Optional<@Size(max = 1000) String> imageUrl;

    private Boolean removeImage;
}
