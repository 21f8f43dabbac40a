package com.care.backoffice.service;

import com.care.backoffice.dto.PatientCreateRequest;
import com.care.backoffice.dto.PatientUpdateRequest;
import com.care.backoffice.dto.PatientView;
import com.care.backoffice.dto.ServiceUsageView;
import com.care.backoffice.dto.AppointmentCreateRequest;
import com.care.backoffice.entity.MedicalService;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.repository.PatientServiceUsageRepository;
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
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PatientServiceTest {

    @Autowired
    private PatientService patientService;
    @Autowired
    private AppointmentService appointmentService;
    @Autowired
    private MedicalServiceRepository serviceRepository;
    @Autowired
    private PatientServiceUsageRepository usageRepository;
    @Autowired
    private JdbcTemplate jdbc;

    private MedicalService cleaning;
    private MedicalService whitening;
    private MedicalService xray;

    @BeforeEach
    void setUp() {
        DatabaseCleaner.clean(jdbc);
        cleaning = Fixtures.service(serviceRepository, "Cleaning");
        whitening = Fixtures.service(serviceRepository, "Whitening");
        xray = Fixtures.service(serviceRepository, "X-Ray");
    }

    @Test
    void createTrimsFieldsAndRecordsUsages() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("  Ana ")
                .lastName(" Lima")
                .phone("   ")
                .serviceIds(List.of(cleaning.getId(), whitening.getId()))
                .build());

        assertEquals("Ana", created.firstName());
        assertEquals("Lima", created.lastName());
        assertNull(created.phone());
        assertEquals(Set.of(cleaning.getId(), whitening.getId()), serviceIds(created));
    }

    @Test
    void duplicateServiceIdsCollapse() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("Ana")
                .lastName("Lima")
                .serviceIds(List.of(cleaning.getId(), cleaning.getId()))
                .build());

        assertEquals(1, patientService.get(created.id()).serviceUsages().size());
    }

    @Test
    void reconcileKeepsUnchangedUsageAndItsTimestamp() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("Ana")
                .lastName("Lima")
                .serviceIds(List.of(cleaning.getId(), whitening.getId()))
                .build());
        Instant whiteningUsedAt = usedAt(patientService.get(created.id()), whitening);

        patientService.update(created.id(), PatientUpdateRequest.builder()
                .serviceIds(List.of(whitening.getId(), xray.getId()))
                .build());

        PatientView after = patientService.get(created.id());
        assertEquals(Set.of(whitening.getId(), xray.getId()), serviceIds(after));
        assertEquals(whiteningUsedAt, usedAt(after, whitening));
    }

    @Test
    void emptyServiceListRemovesAllUsages() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("Ana")
                .lastName("Lima")
                .serviceIds(List.of(cleaning.getId()))
                .build());

        patientService.update(created.id(), PatientUpdateRequest.builder().serviceIds(List.of()).build());

        assertTrue(patientService.get(created.id()).serviceUsages().isEmpty());
    }

    @Test
    void unknownServiceRollsBackFieldChanges() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("Ana")
                .lastName("Lima")
                .serviceIds(List.of(cleaning.getId()))
                .build());

        IntegrityException ex = assertThrows(IntegrityException.class, () ->
                patientService.update(created.id(), PatientUpdateRequest.builder()
                        .firstName("Changed")
                        .serviceIds(List.of(cleaning.getId(), 9999L))
                        .build()));

        assertEquals("serviceIds", ex.getDetails().get(0).field());
        PatientView after = patientService.get(created.id());
        assertEquals("Ana", after.firstName());
        assertEquals(Set.of(cleaning.getId()), serviceIds(after));
    }

    @Test
    void explicitNullClearsOptionalField() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("Ana")
                .lastName("Lima")
                .email("ana@example.com")
                .notes("allergic to latex")
                .build());

        PatientView updated = patientService.update(created.id(), PatientUpdateRequest.builder()
                .email(Optional.empty())
                .build());

        assertNull(updated.email());
        assertEquals("allergic to latex", updated.notes());
    }

    @Test
    void deleteRemovesUsages() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("Ana")
                .lastName("Lima")
                .serviceIds(List.of(cleaning.getId(), xray.getId()))
                .build());

        patientService.delete(created.id());

        assertEquals(0, usageRepository.count());
        assertThrows(NotFoundException.class, () -> patientService.get(created.id()));
    }

    @Test
    void patientWithAppointmentsCannotBeDeleted() {
        PatientView created = patientService.create(PatientCreateRequest.builder()
                .firstName("Ana")
                .lastName("Lima")
                .build());
        appointmentService.create(AppointmentCreateRequest.builder()
                .patientId(created.id())
                .serviceId(cleaning.getId())
                .date(Instant.parse("2030-01-01T10:00:00Z"))
                .build());

        assertThrows(IntegrityException.class, () -> patientService.delete(created.id()));
    }

    private static Set<Long> serviceIds(PatientView patient) {
        return patient.serviceUsages().stream().map(ServiceUsageView::serviceId).collect(Collectors.toSet());
    }

    private static Instant usedAt(PatientView patient, MedicalService service) {
        return patient.serviceUsages().stream()
                .filter(u -> u.serviceId().equals(service.getId()))
                .findFirst()
                .map(ServiceUsageView::usedAt)
                .orElseThrow();
    }
}
