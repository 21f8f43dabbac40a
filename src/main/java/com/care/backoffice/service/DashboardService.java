package com.care.backoffice.service;

import com.care.backoffice.dto.AppointmentView;
import com.care.backoffice.dto.DashboardSummary;
import com.care.backoffice.entity.AppointmentStatus;
import com.care.backoffice.repository.AppointmentRepository;
import com.care.backoffice.repository.MedicalServiceRepository;
import com.care.backoffice.repository.PatientRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
@RequiredArgsConstructor
public class DashboardService {

    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;
    private final MedicalServiceRepository serviceRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DashboardSummary summary() {
        Instant now = clock.instant();
        return new DashboardSummary(
                patientRepository.count(),
                appointmentRepository.count(),
                serviceRepository.count(),
                appointmentRepository.countByDateGreaterThanEqualAndStatus(now, AppointmentStatus.BOOKED),
                patientRepository.countByCreatedAtAfter(now.minus(Duration.ofDays(7))),
                appointmentRepository.findTop6ByOrderByDateDesc().stream().map(AppointmentView::from).toList(),
                patientRepository.findTop5ByOrderByCreatedAtDesc().stream()
                        .map(p -> new DashboardSummary.RecentPatient(p.getId(), p.getFirstName(), p.getLastName(), p.getCreatedAt()))
                        .toList());
    }
}
