package com.care.backoffice.dto;

import com.care.backoffice.entity.PatientServiceUsage;

import java.time.Instant;

public record ServiceUsageView(Long id, Long serviceId, String serviceName, Instant usedAt) {

    public static ServiceUsageView from(PatientServiceUsage u) {
        return new ServiceUsageView(u.getId(), u.getService().getId(), u.getService().getName(), u.getUsedAt());
    }
}
