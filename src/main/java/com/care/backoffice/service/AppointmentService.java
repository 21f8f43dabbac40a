package com.care.backoffice.service;

import com.care.backoffice.dto.AppointmentCreateRequest;
import com.care.backoffice.dto.AppointmentUpdateRequest;
import com.care.backoffice.dto.AppointmentView;
import com.care.backoffice.dto.PublicBookingRequest;
import com.care.backoffice.entity.*;
import com.care.backoffice.exception.IntegrityException;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.repository.*;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Appointment lifecycle: booking (admin and public), partial updates, removal
 * and listing. Every stored appointment is linked to a registered patient or
 * carries a guest name, never both and never neither.
 */
@Service
@RequiredArgsConstructor
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    static final String MISSING_PATIENT_MSG = "Provide a patient or enter a name.";

    private final AppointmentRepository appointmentRepository;
    private final PatientRepository patientRepository;
    private final MedicalServiceRepository serviceRepository;
    private final StaffUserRepository userRepository;

    // =========================================================
    // READ
    // =========================================================
    @Transactional(readOnly = true)
    public List<AppointmentView> list(AppointmentStatus status, Long patientId, Instant from, Instant to) {
        Specification<Appointment> spec = Specification.where(AppointmentSpecifications.hasStatus(status))
                .and(AppointmentSpecifications.forPatient(patientId))
                .and(AppointmentSpecifications.onOrAfter(from))
                .and(AppointmentSpecifications.onOrBefore(to));
        return appointmentRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "date")).stream()
                .map(AppointmentView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public AppointmentView get(Long id) {
        return AppointmentView.from(load(id));
    }

    // =========================================================
    // CREATE
    // =========================================================
    @Transactional
    public AppointmentView create(AppointmentCreateRequest request) {
        Appointment appointment = Appointment.builder()
                .service(requireService(request.getServiceId()))
                .staff(request.getStaffId() != null ? requireStaff(request.getStaffId()) : null)
                .date(request.getDate())
                .status(request.getStatus() != null ? request.getStatus() : AppointmentStatus.BOOKED)
                .notes(request.getNotes())
                .build();
        identifyPatient(appointment, request.getPatientId(), request.getPatientName());

        appointment = appointmentRepository.save(appointment);
        log.info("Booked appointment {}: service={} patient={} guest={} date={}",
                appointment.getId(), request.getServiceId(), request.getPatientId(),
                appointment.getCustomPatientName(), appointment.getDate());
        return AppointmentView.from(appointment);
    }

    /**
     * Booking from the public site: always {@link AppointmentStatus#BOOKED},
     * never assigned to staff.
     */
    @Transactional
    public AppointmentView createPublic(PublicBookingRequest request) {
        Appointment appointment = Appointment.builder()
                .service(requireService(request.getServiceId()))
                .date(request.getDate())
                .status(AppointmentStatus.BOOKED)
                .notes(StringUtils.trimToNull(request.getNotes()))
                .build();
        identifyPatient(appointment, request.getPatientId(), request.getPatientName());

        appointment = appointmentRepository.save(appointment);
        log.info("Public booking {}: service={} date={}", appointment.getId(), request.getServiceId(), appointment.getDate());
        return AppointmentView.from(appointment);
    }

    // =========================================================
    // UPDATE
    // =========================================================
    @Transactional
    public AppointmentView update(Long id, AppointmentUpdateRequest request) {
        Appointment appointment = load(id);

        if (request.getPatientId() != null) {
            Long patientId = request.getPatientId().orElse(null);
            if (patientId != null) {
                appointment.setPatient(requirePatient(patientId));
                appointment.setCustomPatientName(null);
            } else {
                appointment.setPatient(null);
                if (request.getPatientName() != null) {
                    appointment.setCustomPatientName(guestName(request.getPatientName().orElse(null)));
                }
            }
        } else if (request.getPatientName() != null) {
            appointment.setCustomPatientName(guestName(request.getPatientName().orElse(null)));
            if (appointment.getCustomPatientName() != null) {
                appointment.setPatient(null);
            }
        }

        if (appointment.getPatient() == null && appointment.getCustomPatientName() == null) {
            throw ValidationException.of("patientId", MISSING_PATIENT_MSG);
        }

        if (request.getServiceId() != null) {
            appointment.setService(requireService(request.getServiceId()));
        }
        if (request.getStaffId() != null) {
            Long staffId = request.getStaffId().orElse(null);
            appointment.setStaff(staffId != null ? requireStaff(staffId) : null);
        }
        if (request.getDate() != null) {
            appointment.setDate(request.getDate());
        }
        if (request.getStatus() != null) {
            if (request.getStatus() != appointment.getStatus()) {
                log.info("Appointment {} status {} -> {}", id, appointment.getStatus(), request.getStatus());
            }
            appointment.setStatus(request.getStatus());
        }
        if (request.getNotes() != null) {
            appointment.setNotes(request.getNotes().orElse(null));
        }

        appointment = appointmentRepository.saveAndFlush(appointment);
        log.info("Updated appointment {}", id);
        return AppointmentView.from(appointment);
    }

    // =========================================================
    // DELETE
    // =========================================================
    @Transactional
    public void delete(Long id) {
        Appointment appointment = load(id);
        appointmentRepository.delete(appointment);
        log.info("Deleted appointment {}", id);
    }

    // =========================================================
    // HELPERS
    // =========================================================

    /**
     * Applies the patient-or-guest rule for a new appointment: a patient id
     * wins over a guest name, a blank guest name counts as absent.
     */
    private void identifyPatient(Appointment appointment, Long patientId, String patientName) {
        if (patientId != null) {
            appointment.setPatient(requirePatient(patientId));
            appointment.setCustomPatientName(null);
            return;
        }
        String guest = guestName(patientName);
        if (guest == null) {
            throw ValidationException.of("patientId", MISSING_PATIENT_MSG);
        }
        appointment.setPatient(null);
        appointment.setCustomPatientName(guest);
    }

    private static String guestName(String raw) {
        return StringUtils.trimToNull(raw);
    }

    private Appointment load(Long id) {
        return appointmentRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("appointment", id));
    }

    private MedicalService requireService(Long serviceId) {
        return serviceRepository.findById(serviceId)
                .orElseThrow(() -> new IntegrityException("serviceId", "Service does not exist."));
    }

    private StaffUser requireStaff(Long staffId) {
        return userRepository.findById(staffId)
                .orElseThrow(() -> new IntegrityException("staffId", "Staff member does not exist."));
    }

    private Patient requirePatient(Long patientId) {
        return patientRepository.findById(patientId)
                .orElseThrow(() -> new IntegrityException("patientId", "Patient does not exist."));
    }
}
