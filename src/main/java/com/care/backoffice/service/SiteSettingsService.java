package com.care.backoffice.service;

import com.care.backoffice.dto.SiteSettingsRequest;
import com.care.backoffice.entity.SiteSettings;
import com.care.backoffice.repository.SiteSettingsRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The single site-wide settings row. Reads before the first save return
 * unsaved defaults.
 */
@Service
@RequiredArgsConstructor
public class SiteSettingsService {

    private static final Logger log = LoggerFactory.getLogger(SiteSettingsService.class);

    private final SiteSettingsRepository settingsRepository;

    @Transactional(readOnly = true)
    public SiteSettings get() {
        return settingsRepository.findById(SiteSettings.SINGLETON_ID)
                .orElseGet(() -> SiteSettings.builder().id(SiteSettings.SINGLETON_ID).build());
    }

    @Transactional
    public SiteSettings save(SiteSettingsRequest request) {
        SiteSettings settings = settingsRepository.findById(SiteSettings.SINGLETON_ID)
                .orElseGet(() -> SiteSettings.builder().id(SiteSettings.SINGLETON_ID).build());
        settings.setHomeHeroAnnouncement(StringUtils.trimToNull(request.getHomeHeroAnnouncement()));
        settings = settingsRepository.save(settings);
        log.info("Site settings saved (announcement {})", settings.getHomeHeroAnnouncement() == null ? "cleared" : "set");
        return settings;
    }
}
