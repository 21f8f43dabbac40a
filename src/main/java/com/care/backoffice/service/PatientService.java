package com.care.backoffice.service;

import com.care.backoffice.dto.PatientCreateRequest;
import com.care.backoffice.dto.PatientUpdateRequest;
import com.care.backoffice.dto.PatientView;
import com.care.backoffice.dto.ServiceUsageView;
import com.care.backoffice.entity.Patient;
import com.care.backoffice.entity.PatientServiceUsage;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.repository.AppointmentRepository;
import com.care.backoffice.repository.PatientAccountRepository;
import com.care.backoffice.repository.PatientRepository;
import com.care.backoffice.repository.PatientServiceUsageRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class PatientService {

    private static final Logger log = LoggerFactory.getLogger(PatientService.class);

    private final PatientRepository patientRepository;
    private final PatientServiceUsageRepository usageRepository;
    private final PatientAccountRepository accountRepository;
    private final AppointmentRepository appointmentRepository;
    private final ServiceUsageReconciler usageReconciler;

    @Transactional(readOnly = true)
    public List<PatientView> list() {
        Map<Long, List<ServiceUsageView>> usagesByPatient = usageRepository.findAllWithService().stream()
                .collect(Collectors.groupingBy(u -> u.getPatient().getId(),
                        Collectors.mapping(ServiceUsageView::from, Collectors.toList())));
        return patientRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(p -> PatientView.from(p, usagesByPatient.getOrDefault(p.getId(), List.of())))
                .toList();
    }

    @Transactional(readOnly = true)
    public PatientView get(Long id) {
        return view(load(id));
    }

    @Transactional(readOnly = true)
    public Optional<PatientView> findByEmail(String email) {
        return patientRepository.findByEmail(email.trim()).map(this::view);
    }

    /**
     * Creates the patient and its initial service usages in one transaction.
     */
    @Transactional
    public PatientView create(PatientCreateRequest request) {
        Patient patient = Patient.builder()
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName().trim())
                .phone(StringUtils.trimToNull(request.getPhone()))
                .email(StringUtils.trimToNull(request.getEmail()))
                .dob(request.getDob())
                .notes(request.getNotes())
                .build();
        patient = patientRepository.saveAndFlush(patient);

        if (request.getServiceIds() != null) {
            usageReconciler.recordInitial(patient, request.getServiceIds());
        }
        log.info("Created patient {}", patient.getId());
        return view(patient);
    }

    /**
     * Applies the field changes and, when {@code serviceIds} is present, brings
     * the usage set in line with it. Any failure rolls back both.
     */
    @Transactional
    public PatientView update(Long id, PatientUpdateRequest request) {
        Patient patient = load(id);

        if (request.getFirstName() != null) patient.setFirstName(request.getFirstName().trim());
        if (request.getLastName() != null) patient.setLastName(request.getLastName().trim());
        if (request.getPhone() != null) patient.setPhone(StringUtils.trimToNull(request.getPhone().orElse(null)));
        if (request.getEmail() != null) patient.setEmail(StringUtils.trimToNull(request.getEmail().orElse(null)));
        if (request.getDob() != null) patient.setDob(request.getDob().orElse(null));
        if (request.getNotes() != null) patient.setNotes(request.getNotes().orElse(null));
        patient = patientRepository.saveAndFlush(patient);

        if (request.getServiceIds() != null) {
            usageReconciler.reconcile(patient, request.getServiceIds());
        }
        log.info("Updated patient {}", id);
        return view(patient);
    }

    /**
     * Removes the patient with its usage history and portal account. Patients
     * still referenced by appointments are kept.
     */
    @Transactional
    public void delete(Long id) {
        Patient patient = load(id);
        if (appointmentRepository.countByPatientId(id) > 0) {
            throw new IntegrityException("id", "Patient has appointments and cannot be deleted.");
        }
        int usages = usageRepository.deleteByPatientId(id);
        accountRepository.deleteByPatientId(id);
        patientRepository.delete(patient);
        log.info("Deleted patient {} ({} usage rows)", id, usages);
    }

    private Patient load(Long id) {
        return patientRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("patient", id));
    }

    private PatientView view(Patient patient) {
        List<PatientServiceUsage> usages = usageRepository.findByPatientIdWithService(patient.getId());
        return PatientView.from(patient, usages.stream().map(ServiceUsageView::from).toList());
    }
}
