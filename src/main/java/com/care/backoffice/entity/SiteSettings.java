package com.care.backoffice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Singleton row, always stored under {@link #SINGLETON_ID}. */
@Entity
@Table(name = "site_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SiteSettings {

    public static final String SINGLETON_ID = "site";

    @Id
    @Column(length = 20)
    private String id;

    @Column(name = "home_hero_announcement", length = 200)
    private String homeHeroAnnouncement;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
