package com.care.backoffice.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SiteSettingsRequest {

    @Size(max = 200, message = "Announcement must not exceed 200 characters")
    private String homeHeroAnnouncement;
}
