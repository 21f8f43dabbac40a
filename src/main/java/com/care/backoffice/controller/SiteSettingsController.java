package com.care.backoffice.controller;

import com.care.backoffice.dto.SiteSettingsRequest;
import com.care.backoffice.entity.SiteSettings;
import com.care.backoffice.service.SiteSettingsService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/site-settings")
public class SiteSettingsController {

    private final SiteSettingsService settingsService;

    public SiteSettingsController(SiteSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public SiteSettings get() {
        return settingsService.get();
    }

    @PutMapping
    public SiteSettings save(@Valid @RequestBody SiteSettingsRequest body) {
        return settingsService.save(body);
    }
}
