package com.care.backoffice.dto;

import com.care.backoffice.entity.MedicalService;

import java.time.Instant;
import java.util.List;

public record ServiceView(
        Long id,
        String name,
        String description,
        String shortDescription,
        Integer priority,
        Integer durationMinutes,
        Integer priceCents,
        boolean active,
        List<String> images,
        Long parentId,
        ServiceRef parent,
        List<SubService> subServices,
        Instant createdAt,
        Instant updatedAt
) {

    public record ServiceRef(Long id, String name) {
    }

    public record SubService(Long id, String name, boolean active, List<String> images, String shortDescription) {

        static SubService from(MedicalService s) {
            return new SubService(s.getId(), s.getName(), s.isActive(), List.copyOf(s.getImages()), s.getShortDescription());
        }
    }

    public static ServiceView from(MedicalService s, List<MedicalService> children) {
        MedicalService parent = s.getParent();
        return new ServiceView(
                s.getId(),
                s.getName(),
                s.getDescription(),
                s.getShortDescription(),
                s.getPriority(),
                s.getDurationMinutes(),
                s.getPriceCents(),
                s.isActive(),
                List.copyOf(s.getImages()),
                parent != null ? parent.getId() : null,
                parent != null ? new ServiceRef(parent.getId(), parent.getName()) : null,
                children.stream().map(SubService::from).toList(),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
