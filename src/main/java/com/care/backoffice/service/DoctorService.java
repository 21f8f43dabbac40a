package com.care.backoffice.service;

import com.care.backoffice.dto.DoctorRequest;
import com.care.backoffice.entity.Doctor;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.repository.DoctorRepository;
import com.care.backoffice.repository.DoctorSpecifications;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class DoctorService {

    private static final Logger log = LoggerFactory.getLogger(DoctorService.class);

    private static final Sort LIST_ORDER = Sort.by(Sort.Order.asc("priority"), Sort.Order.desc("createdAt"));

    private final DoctorRepository doctorRepository;

    @Transactional(readOnly = true)
    public List<Doctor> list(String query, Boolean featured, Boolean active) {
        Specification<Doctor> spec = Specification.where(DoctorSpecifications.matches(StringUtils.trimToNull(query)))
                .and(DoctorSpecifications.featured(featured))
                .and(DoctorSpecifications.active(active));
        return doctorRepository.findAll(spec, LIST_ORDER);
    }

    @Transactional(readOnly = true)
    public Doctor get(Long id) {
        return load(id);
    }

    @Transactional
    public Doctor create(DoctorRequest request) {
        if (StringUtils.isBlank(request.getFullName())) {
            throw ValidationException.of("fullName", "Full name is required");
        }
        Doctor doctor = Doctor.builder()
                .fullName(request.getFullName().trim())
                .active(request.getActive() == null || request.getActive())
                .featured(request.getFeatured() != null && request.getFeatured())
                .build();
        apply(doctor, request);
        doctor = doctorRepository.saveAndFlush(doctor);
        log.info("Created doctor {} ({})", doctor.getId(), doctor.getFullName());
        return doctor;
    }

    @Transactional
    public Doctor update(Long id, DoctorRequest request) {
        Doctor doctor = load(id);
        if (request.getFullName() != null) doctor.setFullName(request.getFullName().trim());
        if (request.getActive() != null) doctor.setActive(request.getActive());
        if (request.getFeatured() != null) doctor.setFeatured(request.getFeatured());
        apply(doctor, request);
        doctor = doctorRepository.saveAndFlush(doctor);
        log.info("Updated doctor {}", id);
        return doctor;
    }

    @Transactional
    public void delete(Long id) {
        doctorRepository.delete(load(id));
        log.info("Deleted doctor {}", id);
    }

    /** Copies the optional profile fields that are present in the request. */
    private static void apply(Doctor doctor, DoctorRequest request) {
        if (request.getTitle() != null) doctor.setTitle(text(request.getTitle()));
        if (request.getSpecialty() != null) doctor.setSpecialty(text(request.getSpecialty()));
        if (request.getShortBio() != null) doctor.setShortBio(text(request.getShortBio()));
        if (request.getBio() != null) doctor.setBio(text(request.getBio()));
        if (request.getEmail() != null) doctor.setEmail(text(request.getEmail()));
        if (request.getPhone() != null) doctor.setPhone(text(request.getPhone()));
        if (request.getPhotoUrl() != null) doctor.setPhotoUrl(text(request.getPhotoUrl()));
        if (request.getYearsExperience() != null) doctor.setYearsExperience(request.getYearsExperience().orElse(null));
        if (request.getPriority() != null) doctor.setPriority(request.getPriority().orElse(null));
        if (request.getLanguages() != null) {
            doctor.getLanguages().clear();
            doctor.getLanguages().addAll(distinct(request.getLanguages()));
        }
        if (request.getGallery() != null) {
            doctor.getGallery().clear();
            doctor.getGallery().addAll(distinct(request.getGallery()));
        }
    }

    // blank counts as cleared
    private static String text(Optional<String> value) {
        return StringUtils.trimToNull(value.orElse(null));
    }

    private static List<String> distinct(List<String> values) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String v : values) {
            String trimmed = StringUtils.trimToNull(v);
            if (trimmed != null) unique.add(trimmed);
        }
        return new ArrayList<>(unique);
    }

    private Doctor load(Long id) {
        return doctorRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("doctor", id));
    }
}
