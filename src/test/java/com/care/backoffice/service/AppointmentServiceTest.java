package com.care.backoffice.service;

import com.care.backoffice.dto.AppointmentCreateRequest;
import com.care.backoffice.dto.AppointmentUpdateRequest;
import com.care.backoffice.dto.AppointmentView;
import com.care.backoffice.dto.PublicBookingRequest;
import com.care.backoffice.entity.AppointmentStatus;
import com.care.backoffice.entity.MedicalService;
import com.care.backoffice.entity.Patient;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.repository.AppointmentRepository;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.repository.PatientRepository;
import com.care.backoffice.support.DatabaseCleaner;
import com.care.backoffice.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class AppointmentServiceTest {

    private static final Instant MONDAY = Instant.parse("2030-03-04T09:00:00Z");

    @Autowired
    private AppointmentService appointmentService;
    @Autowired
    private AppointmentRepository appointmentRepository;
    @Autowired
    private MedicalServiceRepository serviceRepository;
    @Autowired
    private PatientRepository patientRepository;
    @Autowired
    private JdbcTemplate jdbc;

    private MedicalService checkup;
    private Patient jane;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
        checkup = Fixtures.service(serviceRepository, "Checkup");
        jane = Fixtures.patient(patientRepository, "Jane", "Doe");
    }

    @Test
    void guestBookingDefaultsToBooked() {
        AppointmentView created = appointmentService.create(AppointmentCreateRequest.builder()
                .patientName("  Walk In  ")
                .serviceId(checkup.getId())
                .date(MONDAY)
                .build());

        assertEquals(AppointmentStatus.BOOKED, created.status());
        assertNull(created.patientId());
        assertEquals("Walk In", created.customPatientName());
        assertEquals("Walk In", created.displayName());
    }

    @Test
    void patientIdWinsOverGuestName() {
        AppointmentView created = appointmentService.create(AppointmentCreateRequest.builder()
                .patientId(jane.getId())
                .patientName("Someone Else")
                .serviceId(checkup.getId())
                .date(MONDAY)
                .build());

        assertEquals(jane.getId(), created.patientId());
        assertNull(created.customPatientName());
        assertEquals("Jane Doe", created.displayName());
    }

    @Test
    void bookingWithoutPatientOrNameIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () ->
                appointmentService.create(AppointmentCreateRequest.builder()
                        .patientName("   ")
                        .serviceId(checkup.getId())
                        .date(MONDAY)
                        .build()));

        assertEquals("patientId", ex.getDetails().get(0).field());
        assertEquals(0, appointmentRepository.count());
    }

    @Test
    void unknownServiceIsAnIntegrityError() {
        IntegrityException ex = assertThrows(IntegrityException.class, () ->
                appointmentService.create(AppointmentCreateRequest.builder()
                        .patientId(jane.getId())
                        .serviceId(9999L)
                        .date(MONDAY)
                        .build()));

        assertEquals("serviceId", ex.getDetails().get(0).field());
    }

    @Test
    void publicBookingIgnoresStatusAndStaff() {
        AppointmentView created = appointmentService.createPublic(PublicBookingRequest.builder()
                .patientName("Web Visitor")
                .serviceId(checkup.getId())
                .date(MONDAY)
                .notes("  first visit ")
                .build());

        assertEquals(AppointmentStatus.BOOKED, created.status());
        assertNull(created.staffId());
        assertEquals("first visit", created.notes());
    }

    @Test
    void settingPatientClearsGuestName() {
        AppointmentView guest = bookGuest("Walk In");

        AppointmentView updated = appointmentService.update(guest.id(), AppointmentUpdateRequest.builder()
                .patientId(Optional.of(jane.getId()))
                .build());

        assertEquals(jane.getId(), updated.patientId());
        assertNull(updated.customPatientName());
    }

    @Test
    void guestNameReplacesLinkedPatient() {
        AppointmentView linked = bookFor(jane);

        AppointmentView updated = appointmentService.update(linked.id(), AppointmentUpdateRequest.builder()
                .patientName(Optional.of("Walk In"))
                .build());

        assertNull(updated.patientId());
        assertEquals("Walk In", updated.customPatientName());
    }

    @Test
    void clearingPatientWithoutNameIsRejected() {
        AppointmentView linked = bookFor(jane);

        assertThrows(ValidationException.class, () ->
                appointmentService.update(linked.id(), AppointmentUpdateRequest.builder()
                        .patientId(Optional.empty())
                        .build()));

        assertEquals(jane.getId(), appointmentService.get(linked.id()).patientId());
    }

    @Test
    void statusAndNotesCanBeChangedAlone() {
        AppointmentView linked = bookFor(jane);

        AppointmentView updated = appointmentService.update(linked.id(), AppointmentUpdateRequest.builder()
                .status(AppointmentStatus.COMPLETED)
                .notes(Optional.of("done"))
                .build());

        assertEquals(AppointmentStatus.COMPLETED, updated.status());
        assertEquals("done", updated.notes());
        assertEquals(jane.getId(), updated.patientId());
    }

    @Test
    void deletingMissingAppointmentIsNotFound() {
        assertThrows(NotFoundException.class, () -> appointmentService.delete(4242L));
    }

    @Test
    void listFiltersByStatusAndSortsNewestFirst() {
        AppointmentView early = bookFor(jane);
        AppointmentView late = appointmentService.create(AppointmentCreateRequest.builder()
                .patientId(jane.getId())
                .serviceId(checkup.getId())
                .date(MONDAY.plusSeconds(86_400))
                .build());
        AppointmentView cancelled = bookGuest("Gone");
        appointmentService.update(cancelled.id(), AppointmentUpdateRequest.builder()
                .status(AppointmentStatus.CANCELLED)
                .build());

        List<AppointmentView> booked = appointmentService.list(AppointmentStatus.BOOKED, null, null, null);
        assertEquals(List.of(late.id(), early.id()), booked.stream().map(AppointmentView::id).toList());

        List<AppointmentView> forJaneAfterMonday = appointmentService.list(null, jane.getId(), MONDAY.plusSeconds(1), null);
        assertEquals(List.of(late.id()), forJaneAfterMonday.stream().map(AppointmentView::id).toList());
    }

    private AppointmentView bookFor(Patient patient) {
        return appointmentService.create(AppointmentCreateRequest.builder()
                .patientId(patient.getId())
                .serviceId(checkup.getId())
                .date(MONDAY)
                .build());
    }

    private AppointmentView bookGuest(String name) {
        return appointmentService.create(AppointmentCreateRequest.builder()
                .patientName(name)
                .serviceId(checkup.getId())
                .date(MONDAY)
                .build());
    }
}
