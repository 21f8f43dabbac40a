package com.care.backoffice.service;

import com.care.backoffice.dto.SpecialtyClinicRequest;
import com.care.backoffice.entity.SpecialtyClinic;
import com.care.backoffice.exception.FieldError;
import com.care.backoffice.exception.NotFoundException;
import com.care.backoffice.exception.ValidationException;
import com.care.backoffice.repository.SpecialtyClinicRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class SpecialtyClinicService {

    private static final Logger log = LoggerFactory.getLogger(SpecialtyClinicService.class);

    private final SpecialtyClinicRepository clinicRepository;

    @Transactional(readOnly = true)
    public List<SpecialtyClinic> list() {
        return clinicRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public SpecialtyClinic get(Long id) {
        return load(id);
    }

    /** All four fields are required on create. */
    @Transactional
    public SpecialtyClinic create(SpecialtyClinicRequest request) {
        List<FieldError> missing = new ArrayList<>();
        if (StringUtils.isBlank(request.getTitle())) missing.add(new FieldError("title", "Title is required"));
        if (StringUtils.isBlank(request.getName())) missing.add(new FieldError("name", "Name is required"));
        if (StringUtils.isBlank(request.getDescription())) missing.add(new FieldError("description", "Description is required"));
        if (StringUtils.isBlank(request.getImage())) missing.add(new FieldError("image", "Image is required"));
        if (!missing.isEmpty()) {
            throw new ValidationException(missing);
        }
        SpecialtyClinic clinic = clinicRepository.save(SpecialtyClinic.builder()
                .title(request.getTitle().trim())
                .name(request.getName().trim())
                .description(request.getDescription().trim())
                .image(request.getImage().trim())
                .build());
        log.info("Created specialty clinic {} ({})", clinic.getId(), clinic.getName());
        return clinic;
    }

    @Transactional
    public SpecialtyClinic update(Long id, SpecialtyClinicRequest request) {
        SpecialtyClinic clinic = load(id);
        if (request.getTitle() != null) clinic.setTitle(request.getTitle().trim());
        if (request.getName() != null) clinic.setName(request.getName().trim());
        if (request.getDescription() != null) clinic.setDescription(request.getDescription().trim());
        if (request.getImage() != null) clinic.setImage(request.getImage().trim());
        clinic = clinicRepository.saveAndFlush(clinic);
        log.info("Updated specialty clinic {}", id);
        return clinic;
    }

    @Transactional
    public void delete(Long id) {
        clinicRepository.delete(load(id));
        log.info("Deleted specialty clinic {}", id);
    }

    private SpecialtyClinic load(Long id) {
        return clinicRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("specialtyClinic", id));
    }
}
