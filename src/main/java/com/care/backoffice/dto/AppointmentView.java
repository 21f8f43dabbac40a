package com.care.backoffice.dto;

import com.care.backoffice.entity.Appointment;
import com.care.backoffice.entity.AppointmentStatus;

import java.time.Instant;

public record AppointmentView(
        Long id,
        Long patientId,
        String patientFirstName,
        String patientLastName,
        String customPatientName,
        String displayName,
        Long serviceId,
        String serviceName,
        Long staffId,
        String staffName,
        Instant date,
        AppointmentStatus status,
        String notes,
        Instant createdAt,
        Instant updatedAt
) {

    public static AppointmentView from(Appointment a) {
        var patient = a.getPatient();
        var staff = a.getStaff();
        String displayName = patient != null ? patient.getFullName() : a.getCustomPatientName();
        return new AppointmentView(
                a.getId(),
                patient != null ? patient.getId() : null,
                patient != null ? patient.getFirstName() : null,
                patient != null ? patient.getLastName() : null,
                a.getCustomPatientName(),
                displayName,
                a.getService().getId(),
                a.getService().getName(),
                staff != null ? staff.getId() : null,
                staff != null ? staff.getName() : null,
                a.getDate(),
                a.getStatus(),
                a.getNotes(),
                a.getCreatedAt(),
                a.getUpdatedAt()
        );
    }
}
