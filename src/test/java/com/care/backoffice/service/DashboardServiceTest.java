package com.care.backoffice.service;

import com.care.backoffice.dto.AppointmentCreateRequest;
import com.care.backoffice.dto.AppointmentView;
import com.care.backoffice.dto.DashboardSummary;
import com.care.backoffice.entity.AppointmentStatus;
import com.care.backoffice.entity.MedicalService;
import com.care.backoffice.entity.Patient;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.repository.PatientRepository;
import com.care.backoffice.support.DatabaseCleaner;
import com.care.backoffice.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class DashboardServiceTest {

    private static final Instant FAR_FUTURE = Instant.parse("2090-01-01T09:00:00Z");
    private static final Instant PAST = Instant.parse("2001-01-01T09:00:00Z");

    @Autowired
    private DashboardService dashboardService;
    @Autowired
    private AppointmentService appointmentService;
    @Autowired
    private PatientRepository patientRepository;
    @Autowired
    private MedicalServiceRepository serviceRepository;
    @Autowired
    private JdbcTemplate jdbc;

    private MedicalService checkup;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
        checkup = Fixtures.service(serviceRepository, "Checkup");
    }

    @Test
    void emptyClinicHasZeroCounts() {
        DashboardSummary summary = dashboardService.summary();

        assertEquals(0, summary.patients());
        assertEquals(0, summary.appointments());
        assertEquals(1, summary.services());
        assertTrue(summary.latestAppointments().isEmpty());
        assertTrue(summary.newestPatients().isEmpty());
    }

    @Test
    void summaryCountsAndRecentRows() {
        // patient i joined i days ago
        Instant now = Instant.now();
        for (int i = 0; i < 7; i++) {
            Patient p = Fixtures.patient(patientRepository, "P" + i, "Test");
            jdbc.update("UPDATE patient SET created_at = ? WHERE id = ?",
                    Timestamp.from(now.minus(Duration.ofDays(i)).minus(Duration.ofMinutes(1))), p.getId());
        }
        for (int i = 0; i < 5; i++) {
            book(FAR_FUTURE.plus(Duration.ofDays(i)), AppointmentStatus.BOOKED);
        }
        book(FAR_FUTURE.plus(Duration.ofDays(10)), AppointmentStatus.CANCELLED);
        book(PAST, AppointmentStatus.BOOKED);
        book(PAST.plus(Duration.ofDays(1)), AppointmentStatus.COMPLETED);

        DashboardSummary summary = dashboardService.summary();

        assertEquals(7, summary.patients());
        assertEquals(8, summary.appointments());
        assertEquals(1, summary.services());
        assertEquals(5, summary.upcomingBooked());
        assertEquals(7, summary.newPatientsThisWeek());

        List<Instant> latest = summary.latestAppointments().stream().map(AppointmentView::date).toList();
        assertEquals(6, latest.size());
        assertEquals(FAR_FUTURE.plus(Duration.ofDays(10)), latest.get(0));
        assertEquals(FAR_FUTURE, latest.get(5));

        assertEquals(List.of("P0", "P1", "P2", "P3", "P4"),
                summary.newestPatients().stream().map(DashboardSummary.RecentPatient::firstName).toList());
    }

    @Test
    void patientsOlderThanAWeekAreNotNew() {
        Patient old = Fixtures.patient(patientRepository, "Old", "Timer");
        jdbc.update("UPDATE patient SET created_at = ? WHERE id = ?",
                Timestamp.from(Instant.now().minus(Duration.ofDays(30))), old.getId());
        Fixtures.patient(patientRepository, "New", "Comer");

        DashboardSummary summary = dashboardService.summary();

        assertEquals(2, summary.patients());
        assertEquals(1, summary.newPatientsThisWeek());
        assertEquals("New", summary.newestPatients().get(0).firstName());
    }

    private void book(Instant date, AppointmentStatus status) {
        appointmentService.create(AppointmentCreateRequest.builder()
                .patientName("Walk In")
                .serviceId(checkup.getId())
                .date(date)
                .status(status)
                .build());
    }
}
