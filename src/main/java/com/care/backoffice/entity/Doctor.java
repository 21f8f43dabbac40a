package com.care.backoffice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "doctor", uniqueConstraints = {
    @UniqueConstraint(name = "uk_doctor_email", columnNames = "email"),
    @UniqueConstraint(name = "uk_doctor_phone", columnNames = "phone")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Doctor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "full_name", nullable = false, length = 150)
    private String fullName;

    @Column(length = 100)
    private String title;

    @Column(length = 150)
    private String specialty;

    @Column(name = "short_bio", length = 240)
    private String shortBio;

    @Column(length = 8000)
    private String bio;

    @Column(length = 254)
    private String email;

    @Column(length = 30)
    private String phone;

    @Column(name = "years_experience")
    private Integer yearsExperience;

    private Integer priority;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "doctor_language", joinColumns = @JoinColumn(name = "doctor_id"))
    @OrderColumn(name = "position")
    @Column(name = "language", nullable = false, length = 60)
    @Builder.Default
    private List<String> languages = new ArrayList<>();

    @Column(name = "photo_url", length = 1000)
    private String photoUrl;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "doctor_gallery", joinColumns = @JoinColumn(name = "doctor_id"))
    @OrderColumn(name = "position")
    @Column(name = "image", nullable = false, length = 1000)
    @Builder.Default
    private List<String> gallery = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(nullable = false)
    @Builder.Default
    private boolean featured = false;

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
