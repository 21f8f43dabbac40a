package com.care.backoffice.dto;

import java.time.Instant;
import java.util.List;

public record DashboardSummary(
        long patients,
        long appointments,
        long services,
        long upcomingBooked,
        long newPatientsThisWeek,
        List<AppointmentView> latestAppointments,
        List<RecentPatient> newestPatients
) {

    public record RecentPatient(Long id, String firstName, String lastName, Instant createdAt) {
    }
}
